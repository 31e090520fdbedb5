package com.branchsync.ingest.jdbc;

import com.branchsync.ingest.error.CursorStoreException;
import com.branchsync.ingest.model.SyncCursor;
import com.branchsync.ingest.service.SyncCursorStore;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

/**
 * Cursor store in the {@code sync_cursor} table. The forward-only rule is part of the
 * UPDATE predicate, so concurrent writers can never move a cursor back.
 */
public class JdbcSyncCursorStore implements SyncCursorStore {

    static final String SELECT_SQL = """
            SELECT branch_id, last_sync_time, last_sync_batch_id, updated_at
            FROM sync_cursor WHERE branch_id = ?
            """;

    static final String ADVANCE_SQL = """
            UPDATE sync_cursor SET last_sync_time = ?, last_sync_batch_id = ?, updated_at = ?
            WHERE branch_id = ? AND last_sync_time < ?
            """;

    static final String INSERT_SQL = """
            INSERT INTO sync_cursor (branch_id, last_sync_time, last_sync_batch_id, updated_at)
            VALUES (?, ?, ?, ?)
            """;

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public JdbcSyncCursorStore(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    public Optional<SyncCursor> getCursor(String branchId) {
        try {
            List<SyncCursor> rows = jdbcTemplate.query(SELECT_SQL, (rs, rowNum) -> new SyncCursor(
                    rs.getString("branch_id"),
                    rs.getObject("last_sync_time", OffsetDateTime.class).toInstant(),
                    rs.getString("last_sync_batch_id"),
                    toInstant(rs.getObject("updated_at", OffsetDateTime.class))), branchId);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        } catch (DataAccessException ex) {
            throw new CursorStoreException("Failed to read cursor for branch " + branchId, ex);
        }
    }

    @Override
    public boolean setLastSyncTime(String branchId, Instant lastSyncTime, String batchId) {
        OffsetDateTime time = lastSyncTime.atOffset(ZoneOffset.UTC);
        OffsetDateTime now = clock.instant().atOffset(ZoneOffset.UTC);
        try {
            if (jdbcTemplate.update(ADVANCE_SQL, time, batchId, now, branchId, time) > 0) {
                return true;
            }
            if (getCursor(branchId).isPresent()) {
                return false;
            }
            return insertOrAdvance(branchId, time, batchId, now);
        } catch (DataAccessException ex) {
            throw new CursorStoreException("Failed to save cursor for branch " + branchId, ex);
        }
    }

    private boolean insertOrAdvance(String branchId, OffsetDateTime time, String batchId, OffsetDateTime now) {
        try {
            jdbcTemplate.update(INSERT_SQL, branchId, time, batchId, now);
            return true;
        } catch (DuplicateKeyException ex) {
            // another writer created the row first
            return jdbcTemplate.update(ADVANCE_SQL, time, batchId, now, branchId, time) > 0;
        }
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }
}
