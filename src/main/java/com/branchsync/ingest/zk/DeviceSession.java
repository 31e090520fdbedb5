package com.branchsync.ingest.zk;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * One logical connection to a terminal.
 *
 * <p>Sessions are not thread safe. A terminal processes one command at a time and
 * answers against the reply id it was sent, so callers must serialize use; a
 * concurrent call fails fast with {@code IllegalStateException}.</p>
 */
public interface DeviceSession extends AutoCloseable {

    void connect(Duration timeout);

    ZkFrame sendCommand(ZkCommand command, byte[] payload, Duration timeout);

    /**
     * Sends EXIT when connected, then closes the transport. Never throws.
     */
    void disconnect();

    DeviceSessionState state();

    String deviceId();

    List<PunchRecord> readAttendanceLog(Duration timeout);

    Instant getTime(Duration timeout);

    void setTime(Instant time, Duration timeout);

    void clearAttendanceLog(Duration timeout);

    void enableDevice(Duration timeout);

    void disableDevice(Duration timeout);

    String getVersion(Duration timeout);

    @Override
    default void close() {
        disconnect();
    }
}
