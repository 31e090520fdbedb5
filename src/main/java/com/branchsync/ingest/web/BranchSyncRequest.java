package com.branchsync.ingest.web;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;
import java.util.Map;

/**
 * Logs pushed by a branch agent. Entries stay loosely typed because agents forward
 * whatever columns their source produced.
 */
public record BranchSyncRequest(
        @NotBlank(message = "Branch ID is required") String branchId,
        String branchName,
        @NotNull(message = "Invalid logs data - expected array") List<Map<String, Object>> logs,
        String syncTime
) {
}
