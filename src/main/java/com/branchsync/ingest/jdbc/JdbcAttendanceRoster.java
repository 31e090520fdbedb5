package com.branchsync.ingest.jdbc;

import com.branchsync.ingest.model.ResolvedIdentity;
import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.service.AttendanceRoster;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;

/**
 * Everyone mapped at a branch with {@code roster_active} set is expected on weekdays.
 */
public class JdbcAttendanceRoster implements AttendanceRoster {

    static final String ROSTER_SQL = """
            SELECT DISTINCT user_id, user_type, class_id FROM branch_identity
            WHERE branch_id = ? AND roster_active = TRUE
            ORDER BY user_id
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcAttendanceRoster(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<ResolvedIdentity> expectedAttendees(String branchId, LocalDate date) {
        if (date.getDayOfWeek() == DayOfWeek.SATURDAY || date.getDayOfWeek() == DayOfWeek.SUNDAY) {
            return List.of();
        }
        return jdbcTemplate.query(ROSTER_SQL, (rs, rowNum) -> new ResolvedIdentity(
                rs.getString("user_id"),
                UserType.fromRole(rs.getString("user_type")),
                rs.getString("class_id")), branchId);
    }
}
