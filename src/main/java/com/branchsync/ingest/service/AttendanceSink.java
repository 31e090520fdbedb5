package com.branchsync.ingest.service;

import com.branchsync.ingest.error.CommitException;
import com.branchsync.ingest.model.IngestBatch;
import com.branchsync.ingest.model.IngestResult;

/**
 * Durable store for reconciled attendance records.
 *
 * <p>Implementations report an outcome per record. Throwing {@link CommitException}
 * means nothing in the batch can be assumed committed. Must be safe for concurrent
 * calls from different branch workers.</p>
 */
public interface AttendanceSink {

    IngestResult ingest(IngestBatch batch);
}
