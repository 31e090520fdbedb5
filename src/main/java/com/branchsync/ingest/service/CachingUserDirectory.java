package com.branchsync.ingest.service;

import com.branchsync.ingest.model.ResolvedIdentity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Caches successful identity lookups. Misses are not cached so a user enrolled on
 * the platform after their first punch is picked up on the next cycle.
 */
public class CachingUserDirectory implements UserDirectory {
    private final UserDirectory delegate;
    private final Cache<LookupKey, ResolvedIdentity> cache;

    public CachingUserDirectory(UserDirectory delegate, Duration ttl, long maximumSize) {
        this.delegate = delegate;
        this.cache = Caffeine.newBuilder()
                .expireAfterWrite(ttl)
                .maximumSize(maximumSize)
                .build();
    }

    @Override
    public Optional<ResolvedIdentity> resolveIdentity(String branchId, String enrollNumber, String admissionNumber) {
        LookupKey key = new LookupKey(branchId, enrollNumber, admissionNumber);
        ResolvedIdentity cached = cache.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ResolvedIdentity> resolved = delegate.resolveIdentity(branchId, enrollNumber, admissionNumber);
        resolved.ifPresent(identity -> cache.put(key, identity));
        return resolved;
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    private record LookupKey(String branchId, String enrollNumber, String admissionNumber) {
        LookupKey {
            Objects.requireNonNull(branchId, "branchId");
            Objects.requireNonNull(enrollNumber, "enrollNumber");
        }
    }
}
