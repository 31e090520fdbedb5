package com.branchsync.ingest.model;

import java.util.Objects;

public record RecordOutcome(PersonDay personDay, boolean committed, String error) {
    public RecordOutcome {
        Objects.requireNonNull(personDay, "personDay");
    }

    public static RecordOutcome committed(PersonDay personDay) {
        return new RecordOutcome(personDay, true, null);
    }

    public static RecordOutcome failed(PersonDay personDay, String error) {
        return new RecordOutcome(personDay, false, error);
    }
}
