package com.branchsync.ingest.model;

public record CommitFailure(PersonDay personDay, String error) {
}
