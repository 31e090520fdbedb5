package com.branchsync.ingest.zk;

import com.branchsync.ingest.error.DeviceConnectionException;
import com.branchsync.ingest.error.ProtocolException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ZkDeviceSessionTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private FakeZkDevice device;
    private ZkDeviceSession session;

    @AfterEach
    void tearDown() throws IOException {
        if (session != null) {
            session.disconnect();
        }
        if (device != null) {
            device.close();
        }
    }

    @Test
    void handshakeAdoptsDeviceSessionId() throws IOException {
        device = new FakeZkDevice(0x4D2)
                .replyWith(ZkCommand.VERSION, ZkReply.ACK_OK, "Ver 6.60 Apr 2020\0\0".getBytes(StandardCharsets.US_ASCII));
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());

        session.connect(TIMEOUT);
        String version = session.getVersion(TIMEOUT);

        assertThat(session.state()).isEqualTo(DeviceSessionState.CONNECTED);
        assertThat(session.sessionId()).isEqualTo(0x4D2);
        assertThat(version).isEqualTo("Ver 6.60 Apr 2020");
        List<ZkFrame> frames = device.received();
        assertThat(frames.get(0).command()).isEqualTo(ZkCommand.CONNECT.code());
        assertThat(frames.get(0).sessionId()).isZero();
        assertThat(frames.get(0).replyId()).isZero();
        assertThat(frames.get(1).sessionId()).isEqualTo(0x4D2);
        assertThat(frames.get(1).replyId()).isEqualTo(1);
    }

    @Test
    void sentFramesCarryValidChecksums() throws IOException {
        device = new FakeZkDevice(7);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());

        session.connect(TIMEOUT);
        session.setTime(Instant.parse("2024-03-04T05:00:00Z"), TIMEOUT);

        ZkFrame setTime = device.received().get(1);
        assertThat(setTime.command()).isEqualTo(ZkCommand.SET_TIME.code());
        assertThat(ZkProtocolCodec.decodeTime(setTime.data())).isEqualTo(Instant.parse("2024-03-04T05:00:00Z"));
        byte[] reencoded = ZkProtocolCodec.encodeCommand(setTime.command(), setTime.sessionId(), setTime.replyId(), setTime.data());
        assertThat(ZkProtocolCodec.decodeResponse(reencoded).checksum()).isEqualTo(setTime.checksum());
    }

    @Test
    void readsAttendanceLogFromDataReply() throws IOException {
        byte[] log = ByteBuffer.allocate(80)
                .put(ZkProtocolCodecTest.logEntry(11, 1, 0, LocalDateTime.of(2024, 3, 4, 7, 55, 0), 0))
                .put(ZkProtocolCodecTest.logEntry(12, 1, 1, LocalDateTime.of(2024, 3, 4, 16, 5, 0), 0))
                .array();
        device = new FakeZkDevice(1).replyWith(ZkCommand.ATTLOG_RRQ, ZkReply.ACK_DATA, log);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());

        session.connect(TIMEOUT);
        List<PunchRecord> records = session.readAttendanceLog(TIMEOUT);

        assertThat(records).extracting(PunchRecord::enrollNumber).containsExactly(11, 12);
    }

    @Test
    void rejectedCommandRaisesProtocolError() throws IOException {
        device = new FakeZkDevice(1).replyWith(ZkCommand.CLEAR_ATTLOG, ZkReply.ACK_ERROR, null);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);

        assertThatThrownBy(() -> session.clearAttendanceLog(TIMEOUT))
                .isInstanceOf(ProtocolException.class)
                .extracting(ex -> ((ProtocolException) ex).kind())
                .isEqualTo(ProtocolException.Kind.COMMAND_REJECTED);
        assertThat(session.state()).isEqualTo(DeviceSessionState.CONNECTED);
    }

    @Test
    void unknownReplyCodeIsUnexpected() throws IOException {
        device = new FakeZkDevice(1)
                .respond(ZkCommand.GET_TIME, (request, sessionId) -> FakeZkDevice.frame(0x1234, sessionId, request.replyId(), null));
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);

        assertThatThrownBy(() -> session.getTime(TIMEOUT))
                .isInstanceOf(ProtocolException.class)
                .extracting(ex -> ((ProtocolException) ex).kind())
                .isEqualTo(ProtocolException.Kind.UNEXPECTED_COMMAND);
        assertThat(session.state()).isEqualTo(DeviceSessionState.ERRORED);
    }

    @Test
    void replyDeliveredInTwoWritesIsReadWhole() throws IOException {
        byte[] log = ByteBuffer.allocate(80)
                .put(ZkProtocolCodecTest.logEntry(11, 1, 0, LocalDateTime.of(2024, 3, 4, 7, 55, 0), 0))
                .put(ZkProtocolCodecTest.logEntry(12, 1, 1, LocalDateTime.of(2024, 3, 4, 16, 5, 0), 0))
                .array();
        // header plus the first record, then the second record once the line has gone quiet briefly
        device = new FakeZkDevice(1)
                .replyWith(ZkCommand.ATTLOG_RRQ, ZkReply.ACK_DATA, log)
                .splitReply(ZkCommand.ATTLOG_RRQ, ZkProtocolCodec.HEADER_SIZE + 40, Duration.ofMillis(50));
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);

        List<PunchRecord> records = session.readAttendanceLog(TIMEOUT);
        session.enableDevice(TIMEOUT);

        assertThat(records).extracting(PunchRecord::enrollNumber).containsExactly(11, 12);
        assertThat(session.state()).isEqualTo(DeviceSessionState.CONNECTED);
    }

    @Test
    void lateTailOfReplyIsNotTakenAsNextReply() throws IOException {
        byte[] log = ByteBuffer.allocate(80)
                .put(ZkProtocolCodecTest.logEntry(11, 1, 0, LocalDateTime.of(2024, 3, 4, 7, 55, 0), 0))
                .put(ZkProtocolCodecTest.logEntry(12, 1, 1, LocalDateTime.of(2024, 3, 4, 16, 5, 0), 0))
                .array();
        // the tail arrives only after the quiet period has closed the reply
        device = new FakeZkDevice(1)
                .replyWith(ZkCommand.ATTLOG_RRQ, ZkReply.ACK_DATA, log)
                .splitReply(ZkCommand.ATTLOG_RRQ, ZkProtocolCodec.HEADER_SIZE + 40, Duration.ofMillis(400));
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);

        List<PunchRecord> records = session.readAttendanceLog(TIMEOUT);
        sleep(Duration.ofMillis(600));
        session.enableDevice(TIMEOUT);

        assertThat(records).extracting(PunchRecord::enrollNumber).containsExactly(11);
        assertThat(session.state()).isEqualTo(DeviceSessionState.CONNECTED);
        assertThat(device.receivedCommands()).contains(ZkCommand.ENABLE_DEVICE.code());
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
        }
    }

    @Test
    void silentDeviceTimesOutAndLeavesSessionErrored() throws IOException {
        device = new FakeZkDevice(1).silentOn(ZkCommand.ATTLOG_RRQ);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);

        assertThatThrownBy(() -> session.readAttendanceLog(Duration.ofMillis(200)))
                .isInstanceOf(DeviceConnectionException.class)
                .extracting(ex -> ((DeviceConnectionException) ex).kind())
                .isEqualTo(DeviceConnectionException.Kind.TIMEOUT);
        assertThat(session.state()).isEqualTo(DeviceSessionState.ERRORED);
    }

    @Test
    void rejectedHandshakeFailsConnect() throws IOException {
        device = new FakeZkDevice(1).replyWith(ZkCommand.CONNECT, ZkReply.ACK_UNAUTH, null);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());

        assertThatThrownBy(() -> session.connect(TIMEOUT))
                .isInstanceOf(DeviceConnectionException.class)
                .extracting(ex -> ((DeviceConnectionException) ex).kind())
                .isEqualTo(DeviceConnectionException.Kind.HANDSHAKE_REJECTED);
        assertThat(session.state()).isEqualTo(DeviceSessionState.ERRORED);
    }

    @Test
    void closedPortIsRefused() throws IOException {
        int port;
        try (ServerSocket probe = new ServerSocket(0)) {
            port = probe.getLocalPort();
        }
        session = new ZkDeviceSession("front-gate", "127.0.0.1", port);

        assertThatThrownBy(() -> session.connect(TIMEOUT))
                .isInstanceOf(DeviceConnectionException.class)
                .extracting(ex -> ((DeviceConnectionException) ex).kind())
                .isEqualTo(DeviceConnectionException.Kind.REFUSED);
    }

    @Test
    void commandsRequireConnectedSession() {
        session = new ZkDeviceSession("front-gate", "127.0.0.1", ZkProtocolCodec.DEFAULT_PORT);

        assertThatThrownBy(() -> session.sendCommand(ZkCommand.VERSION, null, TIMEOUT))
                .isInstanceOf(DeviceConnectionException.class)
                .extracting(ex -> ((DeviceConnectionException) ex).kind())
                .isEqualTo(DeviceConnectionException.Kind.NOT_CONNECTED);
    }

    @Test
    void disconnectSendsExitAndNeverThrows() throws IOException {
        device = new FakeZkDevice(1);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);

        session.disconnect();

        assertThat(session.state()).isEqualTo(DeviceSessionState.DISCONNECTED);
        assertThat(device.receivedCommands()).containsExactly(ZkCommand.CONNECT.code(), ZkCommand.EXIT.code());
        assertThatCode(session::disconnect).doesNotThrowAnyException();
    }

    @Test
    void disconnectSurvivesVanishedDevice() throws IOException {
        device = new FakeZkDevice(1);
        session = new ZkDeviceSession("front-gate", "127.0.0.1", device.port());
        session.connect(TIMEOUT);
        device.close();

        assertThatCode(session::disconnect).doesNotThrowAnyException();
        assertThat(session.state()).isEqualTo(DeviceSessionState.DISCONNECTED);
    }
}
