package com.branchsync.ingest.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-branch watermark: every punch at or before {@code lastSyncTime} has been committed.
 */
public record SyncCursor(String branchId, Instant lastSyncTime, String lastSyncBatchId, Instant updatedAt) {
    public SyncCursor {
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(lastSyncTime, "lastSyncTime");
    }
}
