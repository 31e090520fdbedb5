package com.branchsync.ingest.model;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one sync cycle. Punch counters count deduplicated raw punches;
 * {@code committedRecords} and {@code failedRecords} count person-days.
 */
public record SyncResult(
        String branchId,
        String batchId,
        SyncOutcome outcome,
        int attempted,
        int committed,
        int unresolved,
        int failed,
        int committedRecords,
        int failedRecords,
        Instant previousWatermark,
        Instant newWatermark,
        List<UnresolvedIdentity> unresolvedIdentities,
        List<CommitFailure> failures,
        String error
) {
    public SyncResult {
        unresolvedIdentities = unresolvedIdentities == null ? List.of() : List.copyOf(unresolvedIdentities);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public static SyncResult aborted(String branchId, String batchId, SyncOutcome outcome, Instant watermark, String error) {
        return new SyncResult(branchId, batchId, outcome, 0, 0, 0, 0, 0, 0, watermark, watermark, List.of(), List.of(), error);
    }

    public static SyncResult noNewEvents(String branchId, String batchId, Instant watermark) {
        return new SyncResult(branchId, batchId, SyncOutcome.NO_NEW_EVENTS, 0, 0, 0, 0, 0, 0, watermark, watermark, List.of(), List.of(), null);
    }

    public boolean watermarkAdvanced() {
        return newWatermark != null && (previousWatermark == null || newWatermark.isAfter(previousWatermark));
    }
}
