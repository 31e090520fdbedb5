package com.branchsync.ingest.zk;

public enum DeviceSessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    DISCONNECTING,
    ERRORED
}
