package com.branchsync.ingest.jdbc;

import com.branchsync.ingest.error.CommitException;
import com.branchsync.ingest.model.AttendanceRecord;
import com.branchsync.ingest.model.AttendanceStatus;
import com.branchsync.ingest.model.AttendanceType;
import com.branchsync.ingest.model.IngestBatch;
import com.branchsync.ingest.model.IngestResult;
import com.branchsync.ingest.model.PersonDay;
import com.branchsync.ingest.model.Provenance;
import com.branchsync.ingest.model.PunchKey;
import com.branchsync.ingest.model.RecordOutcome;
import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.service.AttendanceSink;
import com.branchsync.ingest.service.BranchRegistry;
import com.branchsync.ingest.service.ReconciliationEngine;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Central attendance ledger in the {@code attendance_record} table, one row per
 * person-day. A record arriving for a day that already has a row is merged into it,
 * so a second cycle on the same day extends the clock-out instead of replacing the
 * morning clock-in.
 */
@Repository
public class JdbcAttendanceSink implements AttendanceSink {
    private static final Logger log = LoggerFactory.getLogger(JdbcAttendanceSink.class);
    private static final TypeReference<List<PunchKey>> PUNCH_LIST = new TypeReference<>() {
    };

    static final String SELECT_SQL = """
            SELECT user_id, user_type, branch_id, class_id, attendance_date, clock_in_time, clock_out_time,
                   status, is_late, late_minutes, is_early_departure, early_departure_minutes, total_hours,
                   attendance_type, device_id, sync_batch_id, source_punches
            FROM attendance_record
            WHERE user_id = :userId AND branch_id = :branchId AND attendance_date = :date
            """;

    static final String INSERT_SQL = """
            INSERT INTO attendance_record (user_id, user_type, branch_id, class_id, attendance_date, clock_in_time,
                   clock_out_time, status, is_late, late_minutes, is_early_departure, early_departure_minutes,
                   total_hours, attendance_type, device_id, sync_batch_id, source_punches, synced_at)
            VALUES (:userId, :userType, :branchId, :classId, :date, :clockIn, :clockOut, :status, :late,
                   :lateMinutes, :earlyDeparture, :earlyDepartureMinutes, :totalHours, :attendanceType, :deviceId,
                   :syncBatchId, :sourcePunches, :syncedAt)
            """;

    static final String UPDATE_SQL = """
            UPDATE attendance_record
            SET user_type = :userType, class_id = :classId, clock_in_time = :clockIn, clock_out_time = :clockOut,
                status = :status, is_late = :late, late_minutes = :lateMinutes, is_early_departure = :earlyDeparture,
                early_departure_minutes = :earlyDepartureMinutes, total_hours = :totalHours,
                attendance_type = :attendanceType, device_id = :deviceId, sync_batch_id = :syncBatchId,
                source_punches = :sourcePunches, synced_at = :syncedAt
            WHERE user_id = :userId AND branch_id = :branchId AND attendance_date = :date
            """;

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final ReconciliationEngine engine;
    private final Function<String, ZoneId> zones;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Autowired
    public JdbcAttendanceSink(NamedParameterJdbcTemplate jdbc,
                              TransactionTemplate transactions,
                              ReconciliationEngine engine,
                              BranchRegistry branches,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this(jdbc, transactions, engine, branches::zoneFor, objectMapper, clock);
    }

    public JdbcAttendanceSink(NamedParameterJdbcTemplate jdbc,
                              TransactionTemplate transactions,
                              ReconciliationEngine engine,
                              Function<String, ZoneId> zones,
                              ObjectMapper objectMapper,
                              Clock clock) {
        this.jdbc = jdbc;
        this.transactions = transactions;
        this.engine = engine;
        this.zones = zones;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public IngestResult ingest(IngestBatch batch) {
        ZoneId zone = zones.apply(batch.branchId());
        List<RecordOutcome> outcomes = new ArrayList<>(batch.records().size());
        for (AttendanceRecord record : batch.records()) {
            PersonDay day = record.personDay();
            try {
                transactions.executeWithoutResult(status -> upsert(record, zone, batch.asOf()));
                outcomes.add(RecordOutcome.committed(day));
            } catch (DataAccessResourceFailureException | TransactionException ex) {
                throw new CommitException("Attendance ledger unavailable: " + ex.getMessage(), ex);
            } catch (DataAccessException | IllegalArgumentException ex) {
                log.warn("Rejected attendance record {}: {}", day, ex.getMessage());
                outcomes.add(RecordOutcome.failed(day, ex.getMessage()));
            }
        }
        return new IngestResult(outcomes);
    }

    public List<AttendanceRecord> findByPersonDay(PersonDay day) {
        try {
            return jdbc.query(SELECT_SQL, keyParams(day), (rs, rowNum) -> mapRow(rs));
        } catch (DataAccessException ex) {
            throw new CommitException("Attendance ledger unavailable: " + ex.getMessage(), ex);
        }
    }

    private void upsert(AttendanceRecord record, ZoneId zone, Instant asOf) {
        List<AttendanceRecord> existing = jdbc.query(SELECT_SQL, keyParams(record.personDay()), (rs, rowNum) -> mapRow(rs));
        if (existing.isEmpty()) {
            jdbc.update(INSERT_SQL, params(record));
            return;
        }
        AttendanceRecord merged = engine.merge(existing.get(0), record, zone, asOf);
        jdbc.update(UPDATE_SQL, params(merged));
    }

    private MapSqlParameterSource keyParams(PersonDay day) {
        return new MapSqlParameterSource()
                .addValue("userId", day.userId())
                .addValue("branchId", day.branchId())
                .addValue("date", day.date());
    }

    private MapSqlParameterSource params(AttendanceRecord record) {
        return keyParams(record.personDay())
                .addValue("userType", record.userType().name())
                .addValue("classId", record.classId())
                .addValue("clockIn", toOffset(record.clockInTime()))
                .addValue("clockOut", toOffset(record.clockOutTime()))
                .addValue("status", record.status().code())
                .addValue("late", record.late())
                .addValue("lateMinutes", record.lateMinutes())
                .addValue("earlyDeparture", record.earlyDeparture())
                .addValue("earlyDepartureMinutes", record.earlyDepartureMinutes())
                .addValue("totalHours", record.totalHours())
                .addValue("attendanceType", record.provenance().attendanceType().name())
                .addValue("deviceId", record.provenance().deviceId())
                .addValue("syncBatchId", record.provenance().syncBatchId())
                .addValue("sourcePunches", writePunches(record.sourcePunches()))
                .addValue("syncedAt", toOffset(clock.instant()));
    }

    private AttendanceRecord mapRow(ResultSet rs) throws SQLException {
        return new AttendanceRecord(
                rs.getString("user_id"),
                UserType.valueOf(rs.getString("user_type")),
                rs.getString("branch_id"),
                rs.getString("class_id"),
                rs.getObject("attendance_date", LocalDate.class),
                toInstant(rs.getObject("clock_in_time", OffsetDateTime.class)),
                toInstant(rs.getObject("clock_out_time", OffsetDateTime.class)),
                AttendanceStatus.fromCode(rs.getString("status")),
                rs.getBoolean("is_late"),
                rs.getLong("late_minutes"),
                rs.getBoolean("is_early_departure"),
                rs.getLong("early_departure_minutes"),
                rs.getBigDecimal("total_hours"),
                new Provenance(AttendanceType.valueOf(rs.getString("attendance_type")),
                        rs.getString("device_id"), rs.getString("sync_batch_id")),
                readPunches(rs.getString("source_punches"))
        );
    }

    private String writePunches(List<PunchKey> punches) {
        try {
            return objectMapper.writeValueAsString(punches);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Cannot serialize source punches", ex);
        }
    }

    private List<PunchKey> readPunches(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return objectMapper.readValue(json, PUNCH_LIST);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Stored source punches are not valid JSON", ex);
        }
    }

    private static OffsetDateTime toOffset(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
