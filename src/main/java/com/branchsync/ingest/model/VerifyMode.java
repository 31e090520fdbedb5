package com.branchsync.ingest.model;

public enum VerifyMode {
    FINGERPRINT(1, "Fingerprint"),
    CARD(2, "Card"),
    PASSWORD(3, "Password"),
    OTHER(-1, "Other");

    private final int code;
    private final String prettyLabel;

    VerifyMode(int code, String prettyLabel) {
        this.code = code;
        this.prettyLabel = prettyLabel;
    }

    public int code() {
        return code;
    }

    public String prettyLabel() {
        return prettyLabel;
    }

    public static VerifyMode fromDeviceCode(Integer code) {
        if (code == null) {
            return OTHER;
        }
        for (VerifyMode value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return OTHER;
    }
}
