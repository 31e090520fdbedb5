package com.branchsync.ingest.model;

import java.util.Locale;

public enum PunchDirection {
    IN,
    OUT,
    UNKNOWN;

    /**
     * Maps the device in/out mode byte. 0 check-in, 1 check-out, 2 break-out,
     * 3 break-in, 4 overtime-in, 5 overtime-out.
     */
    public static PunchDirection fromInOutMode(int mode) {
        return switch (mode) {
            case 0, 3, 4 -> IN;
            case 1, 2, 5 -> OUT;
            default -> UNKNOWN;
        };
    }

    /**
     * Maps the CHECKTYPE column of the vendor database ("I"/"O", sometimes numeric).
     */
    public static PunchDirection fromCheckType(String checkType) {
        if (checkType == null || checkType.isBlank()) {
            return UNKNOWN;
        }
        String value = checkType.trim().toUpperCase(Locale.ROOT);
        return switch (value) {
            case "I", "IN", "0" -> IN;
            case "O", "OUT", "1" -> OUT;
            default -> UNKNOWN;
        };
    }

    /**
     * Ordering hint used only when two punches land on the same second.
     */
    public int tieBreakRank() {
        return switch (this) {
            case IN -> 0;
            case UNKNOWN -> 1;
            case OUT -> 2;
        };
    }
}
