package com.branchsync.ingest.extract;

import com.branchsync.ingest.error.ExtractionException;
import com.branchsync.ingest.model.RawPunchEvent;

import java.time.Instant;
import java.util.List;

/**
 * Source of punches for one branch.
 *
 * <p>Returns every punch strictly after {@code lastSyncTime}, ascending by timestamp.
 * No rows is an empty list; an unreachable or failing source raises
 * {@link ExtractionException}. Implementations do not paginate.</p>
 */
public interface RemoteLogExtractor extends AutoCloseable {

    List<RawPunchEvent> extractSince(String branchId, Instant lastSyncTime);

    /**
     * Reachability check behind the branch connectivity endpoint. Throws
     * {@link ExtractionException} when the source cannot be used.
     */
    default void verifyConnectivity() {
    }

    /**
     * Releases resources the extractor owns, such as a branch connection pool.
     */
    @Override
    default void close() {
    }
}
