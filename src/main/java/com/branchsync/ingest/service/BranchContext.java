package com.branchsync.ingest.service;

import com.branchsync.ingest.extract.RemoteLogExtractor;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Everything a sync cycle needs to know about one configured branch.
 */
public record BranchContext(String branchId, String name, ZoneId zone, RemoteLogExtractor extractor) {
    public BranchContext {
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(zone, "zone");
        Objects.requireNonNull(extractor, "extractor");
        name = name == null ? branchId : name;
    }
}
