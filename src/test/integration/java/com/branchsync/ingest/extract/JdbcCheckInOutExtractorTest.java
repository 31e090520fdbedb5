package com.branchsync.ingest.extract;

import com.branchsync.ingest.error.ExtractionException;
import com.branchsync.ingest.model.PunchDirection;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.VerifyMode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdbcCheckInOutExtractorTest {

    private static final ZoneId NAIROBI = ZoneId.of("Africa/Nairobi");

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcCheckInOutExtractor extractor;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        jdbcTemplate.execute("""
                CREATE TABLE USERINFO (USERID INT PRIMARY KEY, BADGENUMBER VARCHAR(24), SSN VARCHAR(20), Name VARCHAR(40))
                """);
        jdbcTemplate.execute("""
                CREATE TABLE CHECKINOUT (USERID INT, CHECKTIME TIMESTAMP, CHECKTYPE VARCHAR(1), VERIFYCODE INT,
                                         SENSORID VARCHAR(5), WorkCode INT)
                """);
        jdbcTemplate.update("INSERT INTO USERINFO VALUES (17, '17', 'ADM-2024-17', 'Amani Otieno')");
        jdbcTemplate.update("INSERT INTO CHECKINOUT VALUES (17, TIMESTAMP '2024-03-04 16:02:00', 'O', 1, '1', 0)");
        jdbcTemplate.update("INSERT INTO CHECKINOUT VALUES (17, TIMESTAMP '2024-03-04 07:55:00', 'I', 1, '1', 0)");
        jdbcTemplate.update("INSERT INTO CHECKINOUT VALUES (99, TIMESTAMP '2024-03-04 08:20:00', 'I', 2, NULL, NULL)");
        jdbcTemplate.update("INSERT INTO CHECKINOUT VALUES (17, TIMESTAMP '2024-03-03 17:00:00', 'O', 1, '1', 0)");
        extractor = new JdbcCheckInOutExtractor(jdbcTemplate, NAIROBI, "nairobi-main-db");
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void returnsPunchesStrictlyAfterWatermarkInOrder() {
        Instant watermark = Instant.parse("2024-03-03T14:00:00Z");

        List<RawPunchEvent> events = extractor.extractSince("nairobi-main", watermark);

        assertThat(events).extracting(RawPunchEvent::timestamp).containsExactly(
                Instant.parse("2024-03-04T04:55:00Z"),
                Instant.parse("2024-03-04T05:20:00Z"),
                Instant.parse("2024-03-04T13:02:00Z"));
    }

    @Test
    void punchAtWatermarkIsNotReturned() {
        List<RawPunchEvent> events = extractor.extractSince("nairobi-main", Instant.parse("2024-03-04T05:20:00Z"));

        assertThat(events).extracting(RawPunchEvent::enrollNumber).containsExactly("17");
        assertThat(events.get(0).direction()).isEqualTo(PunchDirection.OUT);
    }

    @Test
    void joinsUserInfoWhenPresent() {
        List<RawPunchEvent> events = extractor.extractSince("nairobi-main", Instant.parse("2024-03-04T00:00:00Z"));

        RawPunchEvent known = events.get(0);
        assertThat(known.admissionNumber()).isEqualTo("ADM-2024-17");
        assertThat(known.userName()).isEqualTo("Amani Otieno");
        assertThat(known.verifyMode()).isEqualTo(VerifyMode.FINGERPRINT);
        assertThat(known.sourceDeviceId()).isEqualTo("nairobi-main-db:1");
        assertThat(known.branchId()).isEqualTo("nairobi-main");

        RawPunchEvent unknown = events.get(1);
        assertThat(unknown.enrollNumber()).isEqualTo("99");
        assertThat(unknown.admissionNumber()).isNull();
        assertThat(unknown.verifyMode()).isEqualTo(VerifyMode.CARD);
        assertThat(unknown.workCode()).isNull();
        assertThat(unknown.sourceDeviceId()).isEqualTo("nairobi-main-db");
    }

    @Test
    void nothingNewIsAnEmptyList() {
        assertThat(extractor.extractSince("nairobi-main", Instant.parse("2024-03-05T00:00:00Z"))).isEmpty();
    }

    @Test
    void missingTablesRaiseExtractionError() {
        jdbcTemplate.execute("DROP TABLE CHECKINOUT");

        assertThatThrownBy(() -> extractor.extractSince("nairobi-main", Instant.parse("2024-03-04T00:00:00Z")))
                .isInstanceOf(ExtractionException.class)
                .satisfies(ex -> assertThat(((ExtractionException) ex).retryable()).isTrue());
        assertThatThrownBy(extractor::verifyConnectivity).isInstanceOf(ExtractionException.class);
    }

    @Test
    void connectivityCheckFindsVendorTables() {
        assertThatCode(extractor::verifyConnectivity).doesNotThrowAnyException();
    }
}
