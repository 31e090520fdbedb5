package com.branchsync.ingest.service;

import com.branchsync.ingest.model.PunchDirection;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.VerifyMode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns loosely shaped log entries pushed by branch agents into {@link RawPunchEvent}s.
 *
 * <p>Agents send whatever their source produced: numeric or string enroll numbers,
 * timestamps with or without an offset, direction as a CHECKTYPE letter or an in/out
 * mode number. Timestamps without an offset are branch wall-clock time. Entries that
 * cannot be placed on the timeline are rejected individually.</p>
 */
@Component
public class BranchLogMapper {
    private static final Logger log = LoggerFactory.getLogger(BranchLogMapper.class);
    private static final HexFormat HEX = HexFormat.of();
    public static final int RAW_PAYLOAD_LIMIT = 4096;

    private static final DateTimeFormatter LOCAL_TIMESTAMP = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .toFormatter();

    private final ObjectMapper objectMapper;

    public BranchLogMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public record Rejected(int index, String enrollNumber, String admissionNumber, Object timestamp, String message) {
    }

    public record MappedLogs(List<RawPunchEvent> events, List<Rejected> rejected) {
        public MappedLogs {
            events = List.copyOf(events);
            rejected = List.copyOf(rejected);
        }
    }

    public MappedLogs map(String branchId, ZoneId zone, List<Map<String, Object>> logs) {
        List<RawPunchEvent> events = new ArrayList<>();
        List<Rejected> rejected = new ArrayList<>();
        if (logs == null) {
            return new MappedLogs(events, rejected);
        }
        for (int i = 0; i < logs.size(); i++) {
            Map<String, Object> entry = logs.get(i) == null ? Map.of() : new LinkedHashMap<>(logs.get(i));
            String enrollNumber = firstString(entry, List.of("enrollNumber", "enroll_number", "userId", "USERID", "biometricId"));
            String admissionNumber = firstString(entry, List.of("admissionNumber", "admission_number", "SSN"));
            Object rawTimestamp = firstPresent(entry, List.of("timestamp", "checkTime", "CHECKTIME", "recordTime", "punchTime"));
            if (enrollNumber == null) {
                rejected.add(new Rejected(i, null, admissionNumber, rawTimestamp, "Missing enroll number"));
                continue;
            }
            Instant timestamp = toInstant(rawTimestamp, zone);
            if (timestamp == null) {
                rejected.add(new Rejected(i, enrollNumber, admissionNumber, rawTimestamp, "Invalid timestamp format"));
                continue;
            }
            events.add(new RawPunchEvent(
                    branchId,
                    enrollNumber,
                    admissionNumber,
                    firstString(entry, List.of("userName", "name", "Name")),
                    timestamp,
                    direction(entry),
                    VerifyMode.fromDeviceCode(firstInteger(entry, List.of("verifyMode", "verifyCode", "VERIFYCODE"))),
                    firstInteger(entry, List.of("workCode", "WorkCode")),
                    deviceId(branchId, entry),
                    rawPayloadHex(entry)
            ));
        }
        return new MappedLogs(events, rejected);
    }

    Instant toInstant(Object value, ZoneId zone) {
        if (value == null) {
            return null;
        }
        try {
            if (value instanceof Number number) {
                long epoch = number.longValue();
                // Heuristic: milliseconds when the value is too large for seconds.
                if (epoch > 100_000_000_000L) {
                    return Instant.ofEpochMilli(epoch);
                }
                return Instant.ofEpochSecond(epoch);
            }
            if (value instanceof String str && !str.isBlank()) {
                String text = str.trim();
                if (text.matches("\\d+")) {
                    return toInstant(Long.parseLong(text), zone);
                }
                if (hasOffset(text)) {
                    return OffsetDateTime.parse(text.replace(' ', 'T')).toInstant();
                }
                return LocalDateTime.parse(text, LOCAL_TIMESTAMP).atZone(zone).toInstant();
            }
        } catch (DateTimeException | NumberFormatException ex) {
            log.debug("Cannot parse timestamp {}: {}", value, ex.getMessage());
        }
        return null;
    }

    private boolean hasOffset(String text) {
        int timeStart = Math.max(text.indexOf('T'), text.indexOf(' '));
        if (timeStart < 0) {
            return false;
        }
        String time = text.substring(timeStart);
        return time.endsWith("Z") || time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
    }

    private PunchDirection direction(Map<String, Object> entry) {
        Integer inOutMode = firstInteger(entry, List.of("inOutMode", "inOutState"));
        if (inOutMode != null) {
            return PunchDirection.fromInOutMode(inOutMode);
        }
        return PunchDirection.fromCheckType(firstString(entry, List.of("checkType", "CHECKTYPE", "direction")));
    }

    private String deviceId(String branchId, Map<String, Object> entry) {
        String device = firstString(entry, List.of("deviceSerialNumber", "deviceId", "deviceIp"));
        String base = device == null ? branchId + "-push" : device;
        String sensor = firstString(entry, List.of("sensorId", "SENSORID"));
        return sensor == null ? base : base + ":" + sensor;
    }

    private String rawPayloadHex(Map<String, Object> entry) {
        try {
            byte[] json = objectMapper.writeValueAsString(entry).getBytes(StandardCharsets.UTF_8);
            int length = Math.min(json.length, RAW_PAYLOAD_LIMIT);
            return HEX.formatHex(json, 0, length);
        } catch (JsonProcessingException ex) {
            log.debug("Unable to serialize pushed log entry: {}", ex.getMessage());
            return null;
        }
    }

    private Object firstPresent(Map<String, Object> map, List<String> keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private String firstString(Map<String, Object> map, List<String> keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof String str && !str.isBlank()) {
                return str.trim();
            }
            if (value instanceof Number || value instanceof Boolean) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private Integer firstInteger(Map<String, Object> map, List<String> keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value instanceof Number number) {
                return number.intValue();
            }
            if (value instanceof String str && str.trim().matches("-?\\d+")) {
                return Integer.parseInt(str.trim());
            }
        }
        return null;
    }
}
