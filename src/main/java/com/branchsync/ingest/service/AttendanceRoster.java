package com.branchsync.ingest.service;

import com.branchsync.ingest.model.ResolvedIdentity;

import java.time.LocalDate;
import java.util.List;

/**
 * People expected at a branch on a given day. Only used to synthesize absences.
 */
@FunctionalInterface
public interface AttendanceRoster {

    List<ResolvedIdentity> expectedAttendees(String branchId, LocalDate date);

    static AttendanceRoster none() {
        return (branchId, date) -> List.of();
    }
}
