package com.branchsync.ingest.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-record outcome of one sink call; a sink may accept some records and reject others.
 */
public record IngestResult(List<RecordOutcome> outcomes) {
    public IngestResult {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public static IngestResult allCommitted(List<AttendanceRecord> records) {
        List<RecordOutcome> outcomes = new ArrayList<>(records.size());
        for (AttendanceRecord record : records) {
            outcomes.add(RecordOutcome.committed(record.personDay()));
        }
        return new IngestResult(outcomes);
    }

    public static IngestResult allFailed(List<AttendanceRecord> records, String error) {
        List<RecordOutcome> outcomes = new ArrayList<>(records.size());
        for (AttendanceRecord record : records) {
            outcomes.add(RecordOutcome.failed(record.personDay(), error));
        }
        return new IngestResult(outcomes);
    }

    public long committedCount() {
        return outcomes.stream().filter(RecordOutcome::committed).count();
    }
}
