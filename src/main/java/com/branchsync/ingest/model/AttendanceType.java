package com.branchsync.ingest.model;

public enum AttendanceType {
    BIOMETRIC,
    MANUAL,
    API
}
