package com.branchsync.ingest.jdbc;

import com.branchsync.ingest.error.CommitException;
import com.branchsync.ingest.model.AttendanceRecord;
import com.branchsync.ingest.model.AttendanceStatus;
import com.branchsync.ingest.model.AttendanceType;
import com.branchsync.ingest.model.IngestBatch;
import com.branchsync.ingest.model.IngestResult;
import com.branchsync.ingest.model.PunchDirection;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.RecordOutcome;
import com.branchsync.ingest.model.ResolvedIdentity;
import com.branchsync.ingest.model.ResolvedPunch;
import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.model.VerifyMode;
import com.branchsync.ingest.service.ReconciliationEngine;
import com.branchsync.ingest.service.ReconciliationRequest;
import com.branchsync.ingest.service.WorkingHoursPolicy;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class JdbcAttendanceSinkTest {

    private static final String BRANCH = "nairobi-main";
    private static final ZoneId ZONE = ZoneId.of("Africa/Nairobi");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 4);
    private static final ResolvedIdentity ALICE = new ResolvedIdentity("alice", UserType.STUDENT, "grade-4");

    private final ReconciliationEngine engine = new ReconciliationEngine(WorkingHoursPolicy.defaults());
    private EmbeddedDatabase database;
    private JdbcAttendanceSink sink;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .setType(EmbeddedDatabaseType.H2)
                .generateUniqueName(true)
                .addScript("schema.sql")
                .build();
        sink = new JdbcAttendanceSink(
                new NamedParameterJdbcTemplate(database),
                new TransactionTemplate(new DataSourceTransactionManager(database)),
                engine,
                branchId -> ZONE,
                new ObjectMapper().registerModule(new JavaTimeModule()),
                Clock.fixed(Instant.parse("2024-03-04T15:00:00Z"), ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void storesNewPersonDay() {
        AttendanceRecord record = reconcile(ALICE, at("17:00:00"), "07:55:00", "16:05:00");

        IngestResult result = sink.ingest(new IngestBatch(BRANCH, "sync-1", at("17:00:00"), List.of(record)));

        assertThat(result.outcomes()).containsExactly(RecordOutcome.committed(record.personDay()));
        assertThat(sink.findByPersonDay(record.personDay())).containsExactly(record);
    }

    @Test
    void laterCycleExtendsTheSameDay() {
        AttendanceRecord morning = reconcile(ALICE, at("12:00:00"), "07:55:00");
        AttendanceRecord evening = reconcile(ALICE, at("17:00:00"), "16:05:00");

        sink.ingest(new IngestBatch(BRANCH, "sync-1", at("12:00:00"), List.of(morning)));
        sink.ingest(new IngestBatch(BRANCH, "sync-2", at("17:00:00"), List.of(evening)));

        List<AttendanceRecord> stored = sink.findByPersonDay(morning.personDay());
        assertThat(stored).hasSize(1);
        AttendanceRecord merged = stored.get(0);
        assertThat(merged.clockInTime()).isEqualTo(at("07:55:00"));
        assertThat(merged.clockOutTime()).isEqualTo(at("16:05:00"));
        assertThat(merged.status()).isEqualTo(AttendanceStatus.PRESENT);
        assertThat(merged.totalHours()).isEqualByComparingTo(new BigDecimal("8.17"));
        assertThat(merged.provenance().syncBatchId()).isEqualTo("sync-2");
        assertThat(merged.sourcePunches()).hasSize(2);
    }

    @Test
    void replayingABatchChangesNothing() {
        AttendanceRecord record = reconcile(ALICE, at("17:00:00"), "07:55:00", "16:05:00");
        IngestBatch batch = new IngestBatch(BRANCH, "sync-1", at("17:00:00"), List.of(record));

        sink.ingest(batch);
        sink.ingest(batch);

        assertThat(sink.findByPersonDay(record.personDay())).containsExactly(record);
    }

    @Test
    void rejectedRecordDoesNotBlockTheRestOfTheBatch() {
        ResolvedIdentity oversized = new ResolvedIdentity("bob", UserType.STAFF, "c".repeat(100));
        AttendanceRecord bad = reconcile(oversized, at("17:00:00"), "07:55:00");
        AttendanceRecord good = reconcile(ALICE, at("17:00:00"), "07:55:00");

        IngestResult result = sink.ingest(new IngestBatch(BRANCH, "sync-1", at("17:00:00"), List.of(bad, good)));

        assertThat(result.outcomes()).extracting(RecordOutcome::committed).containsExactly(false, true);
        assertThat(result.committedCount()).isEqualTo(1);
        assertThat(sink.findByPersonDay(good.personDay())).hasSize(1);
    }

    @Test
    void unavailableTransactionsFailTheWholeCall() {
        PlatformTransactionManager unavailable = mock(PlatformTransactionManager.class);
        when(unavailable.getTransaction(any())).thenThrow(new CannotCreateTransactionException("pool exhausted"));
        JdbcAttendanceSink offline = new JdbcAttendanceSink(new NamedParameterJdbcTemplate(database),
                new TransactionTemplate(unavailable), engine, branchId -> ZONE, new ObjectMapper(), Clock.systemUTC());
        AttendanceRecord record = reconcile(ALICE, at("17:00:00"), "07:55:00");

        assertThatThrownBy(() -> offline.ingest(new IngestBatch(BRANCH, "sync-1", at("17:00:00"), List.of(record))))
                .isInstanceOf(CommitException.class);
    }

    private AttendanceRecord reconcile(ResolvedIdentity identity, Instant asOf, String... localTimes) {
        List<ResolvedPunch> punches = Arrays.stream(localTimes)
                .map(time -> new ResolvedPunch(new RawPunchEvent(BRANCH, "17", null, null, at(time),
                        PunchDirection.UNKNOWN, VerifyMode.FINGERPRINT, null, "dev-1", null), identity))
                .toList();
        return engine.reconcile(new ReconciliationRequest(BRANCH, ZONE, punches, asOf, "sync-test", AttendanceType.BIOMETRIC))
                .records().get(0);
    }

    private static Instant at(String localTime) {
        return DAY.atTime(LocalTime.parse(localTime)).atZone(ZONE).toInstant();
    }
}
