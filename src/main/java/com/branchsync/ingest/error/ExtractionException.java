package com.branchsync.ingest.error;

/**
 * The branch source (vendor database or device) could not be read. Never advances the watermark.
 */
public final class ExtractionException extends SyncException {

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
