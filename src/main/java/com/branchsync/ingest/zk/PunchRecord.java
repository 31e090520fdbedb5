package com.branchsync.ingest.zk;

import java.time.LocalDateTime;

/**
 * One fixed-width attendance log entry as stored on the terminal. The timestamp is
 * the terminal's wall clock, without zone.
 */
public record PunchRecord(
        int enrollNumber,
        int verifyMode,
        int inOutMode,
        LocalDateTime timestamp,
        int workCode,
        String rawHex
) {
}
