package com.branchsync.ingest.jdbc;

import com.branchsync.ingest.error.IdentityLookupException;
import com.branchsync.ingest.model.ResolvedIdentity;
import com.branchsync.ingest.model.UserType;
import com.branchsync.ingest.service.UserDirectory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * Resolves punches against the {@code branch_identity} mapping table. The admission
 * number, when the branch source supplies one, is tried before the enroll number
 * because enroll numbers get reused when terminals are re-provisioned.
 */
public class JdbcUserDirectory implements UserDirectory {

    static final String BY_ADMISSION_SQL = """
            SELECT user_id, user_type, class_id FROM branch_identity
            WHERE branch_id = ? AND admission_number = ?
            """;

    static final String BY_ENROLL_SQL = """
            SELECT user_id, user_type, class_id FROM branch_identity
            WHERE branch_id = ? AND enroll_number = ?
            """;

    private static final RowMapper<ResolvedIdentity> IDENTITY = (rs, rowNum) -> new ResolvedIdentity(
            rs.getString("user_id"),
            UserType.fromRole(rs.getString("user_type")),
            rs.getString("class_id"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ResolvedIdentity> resolveIdentity(String branchId, String enrollNumber, String admissionNumber) {
        try {
            if (StringUtils.hasText(admissionNumber)) {
                Optional<ResolvedIdentity> byAdmission = first(jdbcTemplate.query(BY_ADMISSION_SQL, IDENTITY, branchId, admissionNumber.trim()));
                if (byAdmission.isPresent()) {
                    return byAdmission;
                }
            }
            if (!StringUtils.hasText(enrollNumber)) {
                return Optional.empty();
            }
            return first(jdbcTemplate.query(BY_ENROLL_SQL, IDENTITY, branchId, enrollNumber.trim()));
        } catch (DataAccessException ex) {
            throw new IdentityLookupException("Identity lookup failed for enroll " + enrollNumber
                    + " at branch " + branchId + ": " + ex.getMessage(), ex);
        }
    }

    private static Optional<ResolvedIdentity> first(List<ResolvedIdentity> matches) {
        return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
    }
}
