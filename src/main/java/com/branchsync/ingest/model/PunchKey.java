package com.branchsync.ingest.model;

import java.time.Instant;
import java.util.Comparator;

/**
 * Identity of a punch for deduplication: two extractions of the same scan share a key.
 */
public record PunchKey(
        String branchId,
        String enrollNumber,
        Instant timestamp,
        String sourceDeviceId
) implements Comparable<PunchKey> {

    private static final Comparator<PunchKey> ORDER = Comparator.comparing(PunchKey::timestamp)
            .thenComparing(PunchKey::branchId)
            .thenComparing(PunchKey::enrollNumber)
            .thenComparing(PunchKey::sourceDeviceId);

    @Override
    public int compareTo(PunchKey other) {
        return ORDER.compare(this, other);
    }
}
