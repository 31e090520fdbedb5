package com.branchsync.ingest.service;

import com.branchsync.ingest.model.SyncCursor;

import java.time.Instant;
import java.util.Optional;

/**
 * Per-branch watermark storage. Cursors only move forward.
 */
public interface SyncCursorStore {

    Optional<SyncCursor> getCursor(String branchId);

    default Optional<Instant> getLastSyncTime(String branchId) {
        return getCursor(branchId).map(SyncCursor::lastSyncTime);
    }

    /**
     * @return {@code false} when the stored watermark is already at or past {@code lastSyncTime}
     */
    boolean setLastSyncTime(String branchId, Instant lastSyncTime, String batchId);
}
