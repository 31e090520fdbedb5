package com.branchsync.ingest.error;

public final class DeviceConnectionException extends SyncException {

    public enum Kind {
        TIMEOUT,
        REFUSED,
        RESET,
        HANDSHAKE_REJECTED,
        NOT_CONNECTED
    }

    private final Kind kind;

    public DeviceConnectionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public DeviceConnectionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public boolean retryable() {
        return kind != Kind.NOT_CONNECTED;
    }
}
