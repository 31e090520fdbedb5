package com.branchsync.ingest.error;

public final class CursorStoreException extends SyncException {

    public CursorStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
