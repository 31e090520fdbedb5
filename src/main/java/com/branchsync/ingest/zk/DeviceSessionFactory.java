package com.branchsync.ingest.zk;

@FunctionalInterface
public interface DeviceSessionFactory {

    DeviceSession open(String deviceId, String host, int port);

    static DeviceSessionFactory tcp() {
        return ZkDeviceSession::new;
    }
}
