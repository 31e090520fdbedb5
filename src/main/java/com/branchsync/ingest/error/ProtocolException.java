package com.branchsync.ingest.error;

/**
 * A malformed or unexpected device frame. The codec never retries; the caller may
 * repeat the whole command.
 */
public final class ProtocolException extends SyncException {

    public enum Kind {
        TRUNCATED,
        CHECKSUM_MISMATCH,
        UNEXPECTED_COMMAND,
        COMMAND_REJECTED
    }

    private final Kind kind;

    public ProtocolException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public boolean retryable() {
        return true;
    }
}
