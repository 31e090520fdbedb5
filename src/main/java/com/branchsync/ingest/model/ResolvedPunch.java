package com.branchsync.ingest.model;

import java.util.Objects;

/**
 * A punch paired with its platform identity; {@code identity} is null when the
 * directory had no mapping for the enroll or admission number.
 */
public record ResolvedPunch(RawPunchEvent event, ResolvedIdentity identity) {
    public ResolvedPunch {
        Objects.requireNonNull(event, "event");
    }

    public boolean resolved() {
        return identity != null;
    }
}
