package com.branchsync.ingest.service;

import com.branchsync.ingest.model.AttendanceType;
import com.branchsync.ingest.model.ResolvedPunch;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Input of one reconciliation pass. {@code asOf} is the single "now" every
 * time-dependent rule is evaluated against.
 */
public record ReconciliationRequest(
        String branchId,
        ZoneId zone,
        List<ResolvedPunch> punches,
        Instant asOf,
        String syncBatchId,
        AttendanceType attendanceType
) {
    public ReconciliationRequest {
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(asOf, "asOf");
        punches = punches == null ? List.of() : List.copyOf(punches);
        attendanceType = attendanceType == null ? AttendanceType.BIOMETRIC : attendanceType;
    }
}
