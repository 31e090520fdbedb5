package com.branchsync.ingest;

import com.branchsync.ingest.model.PunchDirection;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.VerifyMode;
import com.branchsync.ingest.service.BranchLogMapper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BranchLogMapperTest {

    private static final ZoneId NAIROBI = ZoneId.of("Africa/Nairobi");

    private final BranchLogMapper mapper = new BranchLogMapper(new ObjectMapper());

    @Test
    void mapsCommonFields() {
        Map<String, Object> log = new HashMap<>();
        log.put("enrollNumber", 1042);
        log.put("admissionNumber", "ADM-2024-17");
        log.put("userName", "Amani Otieno");
        log.put("timestamp", "2024-03-04 07:55:12");
        log.put("checkType", "I");
        log.put("verifyCode", 1);
        log.put("deviceSerialNumber", "CQZ7231460");
        log.put("sensorId", "2");

        BranchLogMapper.MappedLogs mapped = mapper.map("nairobi-main", NAIROBI, List.of(log));

        assertThat(mapped.rejected()).isEmpty();
        RawPunchEvent event = mapped.events().get(0);
        assertThat(event.branchId()).isEqualTo("nairobi-main");
        assertThat(event.enrollNumber()).isEqualTo("1042");
        assertThat(event.admissionNumber()).isEqualTo("ADM-2024-17");
        assertThat(event.userName()).isEqualTo("Amani Otieno");
        assertThat(event.timestamp()).isEqualTo(Instant.parse("2024-03-04T04:55:12Z"));
        assertThat(event.direction()).isEqualTo(PunchDirection.IN);
        assertThat(event.verifyMode()).isEqualTo(VerifyMode.FINGERPRINT);
        assertThat(event.sourceDeviceId()).isEqualTo("CQZ7231460:2");
        String json = new String(HexFormat.of().parseHex(event.rawPayloadHex()), StandardCharsets.UTF_8);
        assertThat(json).contains("ADM-2024-17");
    }

    @Test
    void inOutModeWinsOverCheckType() {
        Map<String, Object> log = Map.of("enrollNumber", "7", "timestamp", "2024-03-04T16:02:00", "inOutMode", 1, "checkType", "I");

        RawPunchEvent event = mapper.map("nairobi-main", NAIROBI, List.of(log)).events().get(0);

        assertThat(event.direction()).isEqualTo(PunchDirection.OUT);
        assertThat(event.sourceDeviceId()).isEqualTo("nairobi-main-push");
    }

    @Test
    void explicitOffsetIsHonoured() {
        Map<String, Object> log = Map.of("enrollNumber", "7", "timestamp", "2024-03-04T07:55:00Z");

        RawPunchEvent event = mapper.map("nairobi-main", NAIROBI, List.of(log)).events().get(0);

        assertThat(event.timestamp()).isEqualTo(Instant.parse("2024-03-04T07:55:00Z"));
    }

    @Test
    void parsesEpochSecondsAndMillis() {
        Instant expected = Instant.parse("2024-03-04T04:55:00Z");

        assertThat(mapper.map("b", NAIROBI, List.of(Map.of("enrollNumber", "1", "timestamp", expected.getEpochSecond())))
                .events().get(0).timestamp()).isEqualTo(expected);
        assertThat(mapper.map("b", NAIROBI, List.of(Map.of("enrollNumber", "1", "timestamp", expected.toEpochMilli())))
                .events().get(0).timestamp()).isEqualTo(expected);
        assertThat(mapper.map("b", NAIROBI, List.of(Map.of("enrollNumber", "1", "timestamp", String.valueOf(expected.toEpochMilli()))))
                .events().get(0).timestamp()).isEqualTo(expected);
    }

    @Test
    void rejectsEntriesIndividually() {
        Map<String, Object> good = Map.of("enrollNumber", "7", "timestamp", "2024-03-04 07:55:00");
        Map<String, Object> noEnroll = Map.of("timestamp", "2024-03-04 07:56:00");
        Map<String, Object> badTime = Map.of("enrollNumber", "8", "timestamp", "yesterday morning");

        BranchLogMapper.MappedLogs mapped = mapper.map("nairobi-main", NAIROBI, List.of(good, noEnroll, badTime));

        assertThat(mapped.events()).extracting(RawPunchEvent::enrollNumber).containsExactly("7");
        assertThat(mapped.rejected()).extracting(BranchLogMapper.Rejected::message)
                .containsExactly("Missing enroll number", "Invalid timestamp format");
        assertThat(mapped.rejected()).extracting(BranchLogMapper.Rejected::index).containsExactly(1, 2);
    }

    @Test
    void truncatesLargeRawPayload() {
        Map<String, Object> log = new HashMap<>();
        log.put("enrollNumber", "7");
        log.put("timestamp", "2024-03-04 07:55:00");
        log.put("note", "x".repeat(BranchLogMapper.RAW_PAYLOAD_LIMIT + 10));

        RawPunchEvent event = mapper.map("nairobi-main", NAIROBI, List.of(log)).events().get(0);

        assertThat(event.rawPayloadHex()).hasSize(BranchLogMapper.RAW_PAYLOAD_LIMIT * 2);
    }
}
