package com.branchsync.ingest.zk;

/**
 * Command codes understood by the access-control terminal. The numeric values are
 * fixed by the firmware and must not change.
 */
public enum ZkCommand {
    CONNECT(1000),
    EXIT(1001),
    ENABLE_DEVICE(1002),
    DISABLE_DEVICE(1003),
    VERSION(1100),
    ATTLOG_RRQ(1700),
    CLEAR_ATTLOG(1702),
    GET_TIME(1737),
    SET_TIME(1738);

    private final int code;

    ZkCommand(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
