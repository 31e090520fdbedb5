package com.branchsync.ingest.model;

import java.time.Instant;
import java.util.Objects;

/**
 * One observed badge or biometric scan, as extracted from a branch.
 *
 * <p>{@code timestamp} is the device wall-clock reading already placed on the
 * timeline using the branch's configured zone. {@code admissionNumber} and
 * {@code userName} are only present when the source could join them in.</p>
 */
public record RawPunchEvent(
        String branchId,
        String enrollNumber,
        String admissionNumber,
        String userName,
        Instant timestamp,
        PunchDirection direction,
        VerifyMode verifyMode,
        Integer workCode,
        String sourceDeviceId,
        String rawPayloadHex
) {
    public RawPunchEvent {
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(enrollNumber, "enrollNumber");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(sourceDeviceId, "sourceDeviceId");
        direction = direction == null ? PunchDirection.UNKNOWN : direction;
        verifyMode = verifyMode == null ? VerifyMode.OTHER : verifyMode;
    }

    public PunchKey key() {
        return new PunchKey(branchId, enrollNumber, timestamp, sourceDeviceId);
    }
}
