package com.branchsync.ingest.model;

import java.time.LocalDate;
import java.util.Comparator;

public record PersonDay(String userId, String branchId, LocalDate date) implements Comparable<PersonDay> {

    private static final Comparator<PersonDay> ORDER = Comparator.comparing(PersonDay::date)
            .thenComparing(PersonDay::branchId)
            .thenComparing(PersonDay::userId);

    @Override
    public int compareTo(PersonDay other) {
        return ORDER.compare(this, other);
    }
}
