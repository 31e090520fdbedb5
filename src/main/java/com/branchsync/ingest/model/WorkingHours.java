package com.branchsync.ingest.model;

import java.time.LocalTime;
import java.util.Objects;

/**
 * Expected working window for one user type, in branch-local time.
 */
public record WorkingHours(LocalTime start, LocalTime end, int graceMinutes) {
    public WorkingHours {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("end must be after start");
        }
        if (graceMinutes < 0) {
            throw new IllegalArgumentException("graceMinutes must be non-negative");
        }
    }

    public LocalTime lateThreshold() {
        return start.plusMinutes(graceMinutes);
    }
}
