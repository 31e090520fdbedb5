package com.branchsync.ingest.zk;

public enum ZkReply {
    ACK_OK(2000),
    ACK_ERROR(2001),
    ACK_DATA(2002),
    ACK_RETRY(2003),
    ACK_REPEAT(2004),
    ACK_UNAUTH(2005),
    ACK_UNKNOWN(0xFFFF),
    ACK_ERROR_CMD(0xFFFD),
    ACK_ERROR_INIT(0xFFFC),
    ACK_ERROR_DATA(0xFFFB);

    private final int code;

    ZkReply(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static ZkReply fromCode(int code) {
        for (ZkReply value : values()) {
            if (value.code == code) {
                return value;
            }
        }
        return null;
    }

    public static String describe(int code) {
        ZkReply reply = fromCode(code);
        return reply == null ? "UNKNOWN(" + code + ")" : reply.name() + "(" + code + ")";
    }
}
