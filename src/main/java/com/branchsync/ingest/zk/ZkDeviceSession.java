package com.branchsync.ingest.zk;

import com.branchsync.ingest.error.DeviceConnectionException;
import com.branchsync.ingest.error.ProtocolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Blocking TCP session to a terminal.
 *
 * <p>The terminal does not frame its replies with a length, so a response is
 * taken to be the header plus everything that follows until the line has been
 * quiet for {@link #QUIET_PERIOD}. Bytes still queued from an earlier reply are
 * discarded before the next command is written, and an unknown reply code
 * leaves the session {@link DeviceSessionState#ERRORED}.</p>
 */
public class ZkDeviceSession implements DeviceSession {
    private static final Logger log = LoggerFactory.getLogger(ZkDeviceSession.class);

    private static final int READ_CHUNK = 64 * 1024;
    private static final Duration EXIT_TIMEOUT = Duration.ofSeconds(2);
    static final Duration QUIET_PERIOD = Duration.ofMillis(100);

    private final String deviceId;
    private final String host;
    private final int port;
    private final ReplyIdSequence replyIds = new ReplyIdSequence();
    private final AtomicBoolean inFlight = new AtomicBoolean(false);

    private volatile DeviceSessionState state = DeviceSessionState.DISCONNECTED;
    private Socket socket;
    private InputStream in;
    private OutputStream out;
    private int sessionId;

    public ZkDeviceSession(String deviceId, String host, int port) {
        this.deviceId = deviceId;
        this.host = host;
        this.port = port;
    }

    @Override
    public void connect(Duration timeout) {
        if (state == DeviceSessionState.CONNECTED) {
            return;
        }
        if (state != DeviceSessionState.DISCONNECTED && state != DeviceSessionState.ERRORED) {
            throw new IllegalStateException("Cannot connect device " + deviceId + " from state " + state);
        }
        state = DeviceSessionState.CONNECTING;
        replyIds.reset();
        sessionId = 0;
        log.info("Connecting to device {} at {}:{}", deviceId, host, port);
        try {
            socket = new Socket();
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(host, port), timeoutMillis(timeout));
            in = socket.getInputStream();
            out = socket.getOutputStream();

            ZkFrame reply = roundTrip(ZkCommand.CONNECT, null, timeout);
            if (!reply.isReply(ZkReply.ACK_OK)) {
                throw new DeviceConnectionException(DeviceConnectionException.Kind.HANDSHAKE_REJECTED,
                        "Device " + deviceId + " rejected handshake with " + ZkReply.describe(reply.command()));
            }
            sessionId = reply.sessionId();
            state = DeviceSessionState.CONNECTED;
            log.info("Connected to device {} (session={})", deviceId, sessionId);
        } catch (DeviceConnectionException ex) {
            failConnect();
            throw ex;
        } catch (ProtocolException ex) {
            failConnect();
            throw new DeviceConnectionException(DeviceConnectionException.Kind.HANDSHAKE_REJECTED,
                    "Malformed handshake reply from device " + deviceId + ": " + ex.getMessage(), ex);
        } catch (IOException ex) {
            failConnect();
            throw translate(ex, "connect to");
        }
    }

    @Override
    public ZkFrame sendCommand(ZkCommand command, byte[] payload, Duration timeout) {
        if (state != DeviceSessionState.CONNECTED) {
            throw new DeviceConnectionException(DeviceConnectionException.Kind.NOT_CONNECTED,
                    "Device " + deviceId + " is " + state + ", cannot send " + command);
        }
        try {
            return roundTrip(command, payload, timeout);
        } catch (ProtocolException ex) {
            if (ex.kind() == ProtocolException.Kind.UNEXPECTED_COMMAND) {
                // the stream is no longer aligned on frame boundaries
                state = DeviceSessionState.ERRORED;
                closeQuietly();
            }
            throw ex;
        } catch (IOException ex) {
            state = DeviceSessionState.ERRORED;
            closeQuietly();
            throw translate(ex, "send " + command + " to");
        }
    }

    @Override
    public void disconnect() {
        DeviceSessionState current = state;
        if (current == DeviceSessionState.DISCONNECTED) {
            return;
        }
        state = DeviceSessionState.DISCONNECTING;
        if (current == DeviceSessionState.CONNECTED) {
            try {
                roundTrip(ZkCommand.EXIT, null, EXIT_TIMEOUT);
            } catch (IOException | RuntimeException ex) {
                log.debug("EXIT to device {} failed during disconnect: {}", deviceId, ex.getMessage());
            }
        }
        closeQuietly();
        state = DeviceSessionState.DISCONNECTED;
        log.info("Disconnected from device {}", deviceId);
    }

    @Override
    public DeviceSessionState state() {
        return state;
    }

    @Override
    public String deviceId() {
        return deviceId;
    }

    @Override
    public List<PunchRecord> readAttendanceLog(Duration timeout) {
        ZkFrame reply = sendCommand(ZkCommand.ATTLOG_RRQ, null, timeout);
        requireAccepted(ZkCommand.ATTLOG_RRQ, reply);
        byte[] data = reply.data();
        List<PunchRecord> records = ZkProtocolCodec.decodeAttendanceLog(data);
        log.debug("Device {} returned {} log bytes, {} records", deviceId, data.length, records.size());
        return records;
    }

    @Override
    public Instant getTime(Duration timeout) {
        ZkFrame reply = sendCommand(ZkCommand.GET_TIME, null, timeout);
        requireAccepted(ZkCommand.GET_TIME, reply);
        return ZkProtocolCodec.decodeTime(reply.data());
    }

    @Override
    public void setTime(Instant time, Duration timeout) {
        requireAccepted(ZkCommand.SET_TIME, sendCommand(ZkCommand.SET_TIME, ZkProtocolCodec.encodeTime(time), timeout));
    }

    @Override
    public void clearAttendanceLog(Duration timeout) {
        requireAccepted(ZkCommand.CLEAR_ATTLOG, sendCommand(ZkCommand.CLEAR_ATTLOG, null, timeout));
        log.warn("Cleared attendance log on device {}", deviceId);
    }

    @Override
    public void enableDevice(Duration timeout) {
        requireAccepted(ZkCommand.ENABLE_DEVICE, sendCommand(ZkCommand.ENABLE_DEVICE, null, timeout));
    }

    @Override
    public void disableDevice(Duration timeout) {
        requireAccepted(ZkCommand.DISABLE_DEVICE, sendCommand(ZkCommand.DISABLE_DEVICE, null, timeout));
    }

    @Override
    public String getVersion(Duration timeout) {
        ZkFrame reply = sendCommand(ZkCommand.VERSION, null, timeout);
        requireAccepted(ZkCommand.VERSION, reply);
        String raw = new String(reply.data(), StandardCharsets.US_ASCII);
        int nul = raw.indexOf('\0');
        return (nul >= 0 ? raw.substring(0, nul) : raw).trim();
    }

    int sessionId() {
        return sessionId;
    }

    private ZkFrame roundTrip(ZkCommand command, byte[] payload, Duration timeout) throws IOException {
        if (!inFlight.compareAndSet(false, true)) {
            throw new IllegalStateException("Device session " + deviceId + " already has a command in flight");
        }
        try {
            int replyId = replyIds.next();
            byte[] frame = ZkProtocolCodec.encodeCommand(command.code(), sessionId, replyId, payload);
            discardStale(command);
            out.write(frame);
            out.flush();
            ZkFrame reply = ZkProtocolCodec.decodeResponse(readResponse(timeout));
            if (ZkReply.fromCode(reply.command()) == null) {
                throw new ProtocolException(ProtocolException.Kind.UNEXPECTED_COMMAND,
                        "Device " + deviceId + " answered " + command + " with unknown code " + reply.command());
            }
            return reply;
        } finally {
            inFlight.set(false);
        }
    }

    private byte[] readResponse(Duration timeout) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        byte[] chunk = new byte[READ_CHUNK];
        while (buffer.size() < ZkProtocolCodec.HEADER_SIZE) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                throw new SocketTimeoutException("No complete reply header within " + timeout.toMillis() + "ms");
            }
            socket.setSoTimeout((int) Math.min(Integer.MAX_VALUE, remainingMillis));
            int read = in.read(chunk);
            if (read < 0) {
                throw new EOFException("Device closed the connection");
            }
            buffer.write(chunk, 0, read);
        }
        while (true) {
            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMillis <= 0) {
                break;
            }
            socket.setSoTimeout((int) Math.min(QUIET_PERIOD.toMillis(), remainingMillis));
            int read;
            try {
                read = in.read(chunk);
            } catch (SocketTimeoutException quiet) {
                break;
            }
            if (read < 0) {
                break;
            }
            buffer.write(chunk, 0, read);
        }
        return buffer.toByteArray();
    }

    private void discardStale(ZkCommand command) throws IOException {
        long discarded = 0;
        int available;
        while ((available = in.available()) > 0) {
            long skipped = in.skip(available);
            if (skipped <= 0) {
                break;
            }
            discarded += skipped;
        }
        if (discarded > 0) {
            log.warn("Discarded {} stale bytes from device {} before {}", discarded, deviceId, command);
        }
    }

    private void requireAccepted(ZkCommand command, ZkFrame reply) {
        if (!reply.isReply(ZkReply.ACK_OK) && !reply.isReply(ZkReply.ACK_DATA)) {
            throw new ProtocolException(ProtocolException.Kind.COMMAND_REJECTED,
                    "Device " + deviceId + " rejected " + command + " with " + ZkReply.describe(reply.command()));
        }
    }

    private void failConnect() {
        closeQuietly();
        state = DeviceSessionState.ERRORED;
    }

    private DeviceConnectionException translate(IOException ex, String action) {
        String message = "Failed to " + action + " device " + deviceId + " at " + host + ":" + port + ": " + ex.getMessage();
        if (ex instanceof SocketTimeoutException) {
            return new DeviceConnectionException(DeviceConnectionException.Kind.TIMEOUT, message, ex);
        }
        if (ex instanceof ConnectException) {
            return new DeviceConnectionException(DeviceConnectionException.Kind.REFUSED, message, ex);
        }
        // SocketException, EOF and anything else the stack raises mid-stream
        return new DeviceConnectionException(DeviceConnectionException.Kind.RESET, message, ex);
    }

    private void closeQuietly() {
        Socket current = socket;
        socket = null;
        in = null;
        out = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (IOException ex) {
            log.debug("Closing socket for device {} failed: {}", deviceId, ex.getMessage());
        }
    }

    private static int timeoutMillis(Duration timeout) {
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, timeout.toMillis()));
    }
}
