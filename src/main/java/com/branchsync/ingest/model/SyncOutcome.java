package com.branchsync.ingest.model;

public enum SyncOutcome {
    COMPLETED,
    NO_NEW_EVENTS,
    EXTRACTION_FAILED,
    IDENTITY_LOOKUP_FAILED,
    CANCELLED
}
