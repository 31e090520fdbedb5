package com.branchsync.ingest.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Records handed to the sink in one call. {@code asOf} is the instant the cycle
 * reconciled against, so any merge the sink performs stays deterministic.
 */
public record IngestBatch(String branchId, String syncBatchId, Instant asOf, List<AttendanceRecord> records) {
    public IngestBatch {
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(asOf, "asOf");
        records = records == null ? List.of() : List.copyOf(records);
    }
}
