package com.branchsync.ingest.zk;

import com.branchsync.ingest.error.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;

/**
 * Stateless encoder/decoder for the terminal's wire format.
 *
 * <p>Frame layout, all fields unsigned 16-bit little-endian:</p>
 * <pre>
 *   offset 0  command
 *   offset 2  checksum
 *   offset 4  session id
 *   offset 6  reply id
 *   offset 8  payload (no length field)
 * </pre>
 *
 * <p>The checksum is the 16-bit wrap-around sum of every little-endian word of
 * header and payload, taken with the checksum field itself held at zero. A
 * trailing odd byte counts as the low byte of a final word. Terminals reject
 * frames carrying any other checksum.</p>
 */
public final class ZkProtocolCodec {
    private static final Logger log = LoggerFactory.getLogger(ZkProtocolCodec.class);

    public static final int HEADER_SIZE = 8;
    public static final int ATTENDANCE_RECORD_SIZE = 40;
    public static final int REPLY_ID_MODULUS = 0xFFFF;
    public static final int DEFAULT_PORT = 4370;

    private static final int CHECKSUM_OFFSET = 2;
    private static final HexFormat HEX = HexFormat.of();

    private ZkProtocolCodec() {
    }

    public static byte[] encodeCommand(int command, int sessionId, int replyId, byte[] payload) {
        byte[] body = payload == null ? new byte[0] : payload;
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_SIZE + body.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putShort((short) command);
        buffer.putShort((short) 0);
        buffer.putShort((short) sessionId);
        buffer.putShort((short) replyId);
        buffer.put(body);
        byte[] frame = buffer.array();
        int checksum = checksum(frame);
        frame[CHECKSUM_OFFSET] = (byte) (checksum & 0xFF);
        frame[CHECKSUM_OFFSET + 1] = (byte) ((checksum >>> 8) & 0xFF);
        return frame;
    }

    public static ZkFrame decodeResponse(byte[] bytes) {
        if (bytes == null || bytes.length < HEADER_SIZE) {
            throw new ProtocolException(ProtocolException.Kind.TRUNCATED,
                    "Frame too short: " + (bytes == null ? 0 : bytes.length) + " bytes, header needs " + HEADER_SIZE);
        }
        return new ZkFrame(
                readU16(bytes, 0),
                readU16(bytes, 2),
                readU16(bytes, 4),
                readU16(bytes, 6),
                Arrays.copyOfRange(bytes, HEADER_SIZE, bytes.length)
        );
    }

    /**
     * Computes the frame checksum with the checksum field treated as zero, whatever it currently holds.
     */
    public static int checksum(byte[] frame) {
        int sum = 0;
        for (int i = 0; i < frame.length; i += 2) {
            if (i == CHECKSUM_OFFSET) {
                continue;
            }
            int low = frame[i] & 0xFF;
            int high = i + 1 < frame.length ? frame[i + 1] & 0xFF : 0;
            sum = (sum + (low | (high << 8))) & 0xFFFF;
        }
        return sum;
    }

    public static boolean verifyChecksum(byte[] frame) {
        return frame != null && frame.length >= HEADER_SIZE && readU16(frame, CHECKSUM_OFFSET) == checksum(frame);
    }

    public static void requireValidChecksum(byte[] frame) {
        if (frame == null || frame.length < HEADER_SIZE) {
            throw new ProtocolException(ProtocolException.Kind.TRUNCATED, "Frame too short to carry a checksum");
        }
        int embedded = readU16(frame, CHECKSUM_OFFSET);
        int computed = checksum(frame);
        if (embedded != computed) {
            throw new ProtocolException(ProtocolException.Kind.CHECKSUM_MISMATCH,
                    String.format("Checksum mismatch: embedded=0x%04X computed=0x%04X", embedded, computed));
        }
    }

    /**
     * Decodes a flat buffer of 40-byte log entries. A trailing partial entry is the
     * normal result of a truncated device buffer and is dropped without error.
     */
    public static List<PunchRecord> decodeAttendanceLog(byte[] data) {
        if (data == null || data.length < ATTENDANCE_RECORD_SIZE) {
            return List.of();
        }
        int count = data.length / ATTENDANCE_RECORD_SIZE;
        List<PunchRecord> records = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int offset = i * ATTENDANCE_RECORD_SIZE;
            PunchRecord record = decodeRecord(data, offset);
            if (record != null) {
                records.add(record);
            }
        }
        return records;
    }

    public static byte[] encodeTime(Instant time) {
        long seconds = time.getEpochSecond();
        if (seconds < 0 || seconds > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("Device time out of range: " + time);
        }
        return ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN).putInt((int) seconds).array();
    }

    public static Instant decodeTime(byte[] data) {
        if (data == null || data.length < 4) {
            throw new ProtocolException(ProtocolException.Kind.TRUNCATED, "Time payload needs 4 bytes");
        }
        long seconds = ByteBuffer.wrap(data, 0, 4).order(ByteOrder.LITTLE_ENDIAN).getInt() & 0xFFFF_FFFFL;
        return Instant.ofEpochSecond(seconds);
    }

    private static PunchRecord decodeRecord(byte[] data, int offset) {
        int enrollNumber = readU16(data, offset);
        int verifyMode = data[offset + 2] & 0xFF;
        int inOutMode = data[offset + 3] & 0xFF;
        int year = readU16(data, offset + 4);
        int month = data[offset + 6] & 0xFF;
        int day = data[offset + 7] & 0xFF;
        int hour = data[offset + 8] & 0xFF;
        int minute = data[offset + 9] & 0xFF;
        int second = data[offset + 10] & 0xFF;
        int workCode = data[offset + 11] & 0xFF;
        String rawHex = HEX.formatHex(data, offset, offset + ATTENDANCE_RECORD_SIZE);
        try {
            LocalDateTime timestamp = LocalDateTime.of(year, month, day, hour, minute, second);
            return new PunchRecord(enrollNumber, verifyMode, inOutMode, timestamp, workCode, rawHex);
        } catch (DateTimeException ex) {
            log.warn("Skipping log entry for enroll={} with invalid timestamp {}-{}-{} {}:{}:{} raw={}",
                    enrollNumber, year, month, day, hour, minute, second, rawHex);
            return null;
        }
    }

    private static int readU16(byte[] bytes, int offset) {
        return (bytes[offset] & 0xFF) | ((bytes[offset + 1] & 0xFF) << 8);
    }
}
