package com.branchsync.ingest.web;

public record BranchConnectivity(String branchId, String branchName, String timezone) {
}
