package com.branchsync.ingest.error;

/**
 * Base of every failure raised by the ingestion pipeline. Retryable failures are
 * recovered by retry at the orchestrator boundary; the rest halt the cycle.
 */
public abstract class SyncException extends RuntimeException {

    protected SyncException(String message) {
        super(message);
    }

    protected SyncException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean retryable();
}
