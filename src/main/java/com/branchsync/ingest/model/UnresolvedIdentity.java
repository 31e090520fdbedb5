package com.branchsync.ingest.model;

import java.time.Instant;

/**
 * Diagnostic for a punch whose enroll number has no platform user yet.
 */
public record UnresolvedIdentity(
        String branchId,
        String enrollNumber,
        String admissionNumber,
        Instant timestamp,
        String sourceDeviceId
) {
    public static UnresolvedIdentity of(RawPunchEvent event) {
        return new UnresolvedIdentity(
                event.branchId(),
                event.enrollNumber(),
                event.admissionNumber(),
                event.timestamp(),
                event.sourceDeviceId()
        );
    }

    public String message() {
        return "User not found - enroll number " + enrollNumber
                + (admissionNumber == null ? "" : " / admission number " + admissionNumber)
                + " not mapped to any platform user";
    }
}
