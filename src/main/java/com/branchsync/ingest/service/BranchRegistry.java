package com.branchsync.ingest.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Branches this instance polls. Branches that only push logs over HTTP need not be
 * registered; they are reconciled in the default zone.
 */
public class BranchRegistry implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BranchRegistry.class);

    private final Map<String, BranchContext> branches = new LinkedHashMap<>();
    private final ZoneId defaultZone;

    public BranchRegistry(List<BranchContext> branches, ZoneId defaultZone) {
        for (BranchContext branch : branches) {
            if (this.branches.putIfAbsent(branch.branchId(), branch) != null) {
                throw new IllegalArgumentException("Duplicate branch id " + branch.branchId());
            }
        }
        this.defaultZone = defaultZone;
    }

    public Optional<BranchContext> find(String branchId) {
        return Optional.ofNullable(branches.get(branchId));
    }

    public BranchContext require(String branchId) {
        BranchContext branch = branches.get(branchId);
        if (branch == null) {
            throw new UnknownBranchException(branchId);
        }
        return branch;
    }

    /**
     * Checks that the branch's log source can be reached, without reading any punches.
     */
    public BranchContext verifyConnectivity(String branchId) {
        BranchContext branch = require(branchId);
        branch.extractor().verifyConnectivity();
        log.info("Branch {} log source is reachable", branchId);
        return branch;
    }

    public ZoneId zoneFor(String branchId) {
        return find(branchId).map(BranchContext::zone).orElse(defaultZone);
    }

    public Collection<BranchContext> all() {
        return branches.values();
    }

    @Override
    public void close() {
        for (BranchContext branch : branches.values()) {
            try {
                branch.extractor().close();
            } catch (RuntimeException ex) {
                log.warn("Failed to close extractor for branch {}", branch.branchId(), ex);
            }
        }
    }

    public static class UnknownBranchException extends IllegalArgumentException {
        public UnknownBranchException(String branchId) {
            super("Branch " + branchId + " is not configured for polling");
        }
    }
}
