package com.branchsync.ingest.error;

/**
 * The sink could not accept a batch at all. Per-record rejections are reported
 * through {@code IngestResult} instead.
 */
public final class CommitException extends SyncException {

    public CommitException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
