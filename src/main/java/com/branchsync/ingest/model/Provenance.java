package com.branchsync.ingest.model;

import java.util.Objects;

public record Provenance(AttendanceType attendanceType, String deviceId, String syncBatchId) {
    public Provenance {
        Objects.requireNonNull(attendanceType, "attendanceType");
    }
}
