package com.branchsync.ingest.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum AttendanceStatus {
    PRESENT("present"),
    LATE("late"),
    ABSENT("absent"),
    HALF_DAY("half_day"),
    EARLY_DEPARTURE("early_departure");

    private final String code;

    AttendanceStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static AttendanceStatus fromCode(String code) {
        for (AttendanceStatus value : values()) {
            if (value.code.equals(code)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown attendance status " + code);
    }

    /**
     * Status is never stored independently of the clock times and flags it is derived from.
     * Precedence: late, then half day, then early departure, then present.
     *
     * @param shiftEnded whether the expected end of day had passed when the record was reconciled
     */
    public static AttendanceStatus derive(boolean clockedIn,
                                          boolean clockedOut,
                                          boolean late,
                                          boolean earlyDeparture,
                                          boolean shiftEnded) {
        if (!clockedIn) {
            return ABSENT;
        }
        if (late) {
            return LATE;
        }
        if (!clockedOut && shiftEnded) {
            return HALF_DAY;
        }
        if (earlyDeparture) {
            return EARLY_DEPARTURE;
        }
        return PRESENT;
    }
}
