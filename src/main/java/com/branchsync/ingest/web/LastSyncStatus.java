package com.branchsync.ingest.web;

import java.time.Instant;

/**
 * {@code lastSyncTime} comes from the cursor store, so it only ever shows a committed watermark.
 */
public record LastSyncStatus(
        String branchId,
        Instant lastSyncTime,
        String lastSyncBatchId,
        Instant updatedAt,
        String lastOutcome,
        String lastError
) {
}
