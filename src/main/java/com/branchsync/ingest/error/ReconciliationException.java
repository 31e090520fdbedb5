package com.branchsync.ingest.error;

/**
 * A logic fault while folding punches into records. Treated as a bug: not retried,
 * and the branch is suspended until an operator looks at it.
 */
public final class ReconciliationException extends SyncException {

    public ReconciliationException(String message) {
        super(message);
    }

    @Override
    public boolean retryable() {
        return false;
    }
}
