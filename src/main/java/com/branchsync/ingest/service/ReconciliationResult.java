package com.branchsync.ingest.service;

import com.branchsync.ingest.model.AttendanceRecord;
import com.branchsync.ingest.model.UnresolvedIdentity;

import java.util.List;

public record ReconciliationResult(List<AttendanceRecord> records, List<UnresolvedIdentity> unresolved) {
    public ReconciliationResult {
        records = records == null ? List.of() : List.copyOf(records);
        unresolved = unresolved == null ? List.of() : List.copyOf(unresolved);
    }
}
