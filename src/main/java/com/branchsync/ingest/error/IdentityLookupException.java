package com.branchsync.ingest.error;

/**
 * The user directory could not be queried. Distinct from a lookup that simply finds nobody.
 */
public final class IdentityLookupException extends SyncException {

    public IdentityLookupException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
