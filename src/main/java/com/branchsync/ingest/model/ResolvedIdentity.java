package com.branchsync.ingest.model;

import java.util.Objects;

public record ResolvedIdentity(
        String userId,
        UserType userType,
        String classId
) {
    public ResolvedIdentity {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(userType, "userType");
    }
}
