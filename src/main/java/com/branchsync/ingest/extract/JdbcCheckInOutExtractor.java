package com.branchsync.ingest.extract;

import com.branchsync.ingest.error.ExtractionException;
import com.branchsync.ingest.model.PunchDirection;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.VerifyMode;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Comparator;
import java.util.List;

/**
 * Reads punches from the vendor attendance database that terminals replicate into
 * ({@code CHECKINOUT} plus the {@code USERINFO} user table).
 *
 * <p>{@code CHECKTIME} is stored as branch-local wall-clock time, so the watermark is
 * converted into the branch zone for the query and every row is converted back.</p>
 */
public class JdbcCheckInOutExtractor implements RemoteLogExtractor {
    private static final Logger log = LoggerFactory.getLogger(JdbcCheckInOutExtractor.class);

    static final String NEW_PUNCHES_SQL = """
            SELECT c.USERID AS enroll_number,
                   c.CHECKTIME AS check_time,
                   c.CHECKTYPE AS check_type,
                   c.VERIFYCODE AS verify_code,
                   c.SENSORID AS sensor_id,
                   c.WorkCode AS work_code,
                   u.SSN AS admission_number,
                   u.Name AS user_name,
                   u.BADGENUMBER AS badge_number
            FROM CHECKINOUT c
            LEFT JOIN USERINFO u ON c.USERID = u.USERID
            WHERE c.CHECKTIME > ?
            ORDER BY c.CHECKTIME ASC
            """;

    static final String TABLES_SQL = """
            SELECT TABLE_NAME FROM INFORMATION_SCHEMA.TABLES
            WHERE UPPER(TABLE_NAME) IN ('CHECKINOUT', 'USERINFO')
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ZoneId zone;
    private final String deviceId;
    private final HikariDataSource ownedPool;

    public JdbcCheckInOutExtractor(JdbcTemplate jdbcTemplate, ZoneId zone, String deviceId) {
        this(jdbcTemplate, zone, deviceId, null);
    }

    private JdbcCheckInOutExtractor(JdbcTemplate jdbcTemplate, ZoneId zone, String deviceId, HikariDataSource ownedPool) {
        this.jdbcTemplate = jdbcTemplate;
        this.zone = zone;
        this.deviceId = deviceId;
        this.ownedPool = ownedPool;
    }

    /**
     * Extractor that closes {@code pool} when the branch is shut down.
     */
    public static JdbcCheckInOutExtractor owning(HikariDataSource pool, ZoneId zone, String deviceId) {
        return new JdbcCheckInOutExtractor(new JdbcTemplate(pool), zone, deviceId, pool);
    }

    @Override
    public List<RawPunchEvent> extractSince(String branchId, Instant lastSyncTime) {
        LocalDateTime since = LocalDateTime.ofInstant(lastSyncTime, zone);
        try {
            List<RawPunchEvent> events = jdbcTemplate.query(NEW_PUNCHES_SQL,
                    (rs, rowNum) -> mapRow(branchId, rs), since);
            // the source orders by local time; re-sort on the timeline in case of DST folds
            List<RawPunchEvent> sorted = events.stream()
                    .filter(event -> event.timestamp().isAfter(lastSyncTime))
                    .sorted(Comparator.comparing(RawPunchEvent::timestamp))
                    .toList();
            log.debug("Branch {} CHECKINOUT rows after {}: {}", branchId, since, sorted.size());
            return sorted;
        } catch (DataAccessException ex) {
            throw new ExtractionException("CHECKINOUT query failed for branch " + branchId + ": " + ex.getMessage(), ex);
        }
    }

    @Override
    public void verifyConnectivity() {
        try {
            List<String> tables = jdbcTemplate.queryForList(TABLES_SQL, String.class);
            boolean checkInOut = tables.stream().anyMatch(name -> "CHECKINOUT".equalsIgnoreCase(name));
            boolean userInfo = tables.stream().anyMatch(name -> "USERINFO".equalsIgnoreCase(name));
            if (!checkInOut || !userInfo) {
                throw new ExtractionException("Vendor database is missing tables, found " + tables, null);
            }
        } catch (DataAccessException ex) {
            throw new ExtractionException("Vendor database unreachable: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        if (ownedPool != null) {
            ownedPool.close();
        }
    }

    private RawPunchEvent mapRow(String branchId, ResultSet rs) throws SQLException {
        LocalDateTime checkTime = rs.getObject("check_time", LocalDateTime.class);
        String sensorId = trimToNull(rs.getString("sensor_id"));
        int verifyCode = rs.getInt("verify_code");
        Integer verify = rs.wasNull() ? null : verifyCode;
        int workCode = rs.getInt("work_code");
        Integer work = rs.wasNull() ? null : workCode;
        return new RawPunchEvent(
                branchId,
                rs.getString("enroll_number").trim(),
                trimToNull(rs.getString("admission_number")),
                trimToNull(rs.getString("user_name")),
                checkTime.atZone(zone).toInstant(),
                PunchDirection.fromCheckType(rs.getString("check_type")),
                VerifyMode.fromDeviceCode(verify),
                work,
                sensorId == null ? deviceId : deviceId + ":" + sensorId,
                null
        );
    }

    private static String trimToNull(String value) {
        if (!StringUtils.hasText(value)) {
            return null;
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "JdbcCheckInOutExtractor[" + deviceId + ", zone=" + zone.getId() + "]";
    }
}
