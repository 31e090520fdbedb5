package com.branchsync.ingest.web;

import java.time.Instant;
import java.util.List;

public record BranchSyncResponse(
        String batchId,
        int processedCount,
        int errorCount,
        int totalLogs,
        List<SyncError> errors,
        Instant lastSyncTime
) {
    public static final int MAX_REPORTED_ERRORS = 10;

    public record SyncError(String enrollNumber, String admissionNumber, Object timestamp, String message) {
    }
}
