package com.branchsync.ingest.extract;

import com.branchsync.ingest.error.ExtractionException;
import com.branchsync.ingest.error.SyncException;
import com.branchsync.ingest.model.PunchDirection;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.VerifyMode;
import com.branchsync.ingest.service.RetryPolicy;
import com.branchsync.ingest.zk.DeviceSession;
import com.branchsync.ingest.zk.DeviceSessionFactory;
import com.branchsync.ingest.zk.PunchRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Pulls the attendance log straight off a terminal. The terminal has no server-side
 * filter, so the whole log is read and everything at or before the watermark is
 * discarded here.
 *
 * <p>Each call opens its own session and tears it down before returning; sessions are
 * never shared between cycles.</p>
 */
public class DeviceLogExtractor implements RemoteLogExtractor {
    private static final Logger log = LoggerFactory.getLogger(DeviceLogExtractor.class);

    private final DeviceSessionFactory sessionFactory;
    private final String deviceId;
    private final String host;
    private final int port;
    private final Duration connectTimeout;
    private final Duration commandTimeout;
    private final ZoneId zone;
    private final RetryPolicy connectRetry;

    public DeviceLogExtractor(DeviceSessionFactory sessionFactory,
                              String deviceId,
                              String host,
                              int port,
                              Duration connectTimeout,
                              Duration commandTimeout,
                              ZoneId zone,
                              RetryPolicy connectRetry) {
        this.sessionFactory = sessionFactory;
        this.deviceId = deviceId;
        this.host = Objects.requireNonNull(host, "device host");
        this.port = port;
        this.connectTimeout = connectTimeout;
        this.commandTimeout = commandTimeout;
        this.zone = zone;
        this.connectRetry = connectRetry;
    }

    @Override
    public List<RawPunchEvent> extractSince(String branchId, Instant lastSyncTime) {
        DeviceSession session = sessionFactory.open(deviceId, host, port);
        try {
            connectRetry.run("connect device " + deviceId, () -> session.connect(connectTimeout));
            List<PunchRecord> records = readWithDeviceDisabled(session);
            List<RawPunchEvent> events = records.stream()
                    .map(record -> toEvent(branchId, record))
                    .filter(event -> event.timestamp().isAfter(lastSyncTime))
                    .sorted(Comparator.comparing(RawPunchEvent::timestamp))
                    .toList();
            log.info("Device {} log holds {} record(s), {} after {}", deviceId, records.size(), events.size(), lastSyncTime);
            return events;
        } catch (SyncException ex) {
            throw new ExtractionException("Reading attendance log from device " + deviceId + " failed: " + ex.getMessage(), ex);
        } finally {
            session.disconnect();
        }
    }

    @Override
    public void verifyConnectivity() {
        DeviceSession session = sessionFactory.open(deviceId, host, port);
        try {
            session.connect(connectTimeout);
            log.info("Device {} firmware {}", deviceId, session.getVersion(commandTimeout));
        } catch (SyncException ex) {
            throw new ExtractionException("Device " + deviceId + " unreachable: " + ex.getMessage(), ex);
        } finally {
            session.disconnect();
        }
    }

    private List<PunchRecord> readWithDeviceDisabled(DeviceSession session) {
        session.disableDevice(commandTimeout);
        try {
            return session.readAttendanceLog(commandTimeout);
        } finally {
            try {
                session.enableDevice(commandTimeout);
            } catch (SyncException ex) {
                log.warn("Failed to re-enable device {} after reading its log: {}", deviceId, ex.getMessage());
            }
        }
    }

    private RawPunchEvent toEvent(String branchId, PunchRecord record) {
        return new RawPunchEvent(
                branchId,
                String.valueOf(record.enrollNumber()),
                null,
                null,
                record.timestamp().atZone(zone).toInstant(),
                PunchDirection.fromInOutMode(record.inOutMode()),
                VerifyMode.fromDeviceCode(record.verifyMode()),
                record.workCode(),
                deviceId,
                record.rawHex()
        );
    }
}
