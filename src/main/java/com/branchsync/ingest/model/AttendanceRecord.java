package com.branchsync.ingest.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Canonical attendance entry: one per user, branch and branch-local calendar day.
 *
 * <p>The constructor rejects any status that disagrees with the clock times and
 * lateness flags, so a stored status cannot drift from the data it summarises.</p>
 */
public record AttendanceRecord(
        String userId,
        UserType userType,
        String branchId,
        String classId,
        LocalDate date,
        Instant clockInTime,
        Instant clockOutTime,
        AttendanceStatus status,
        boolean late,
        long lateMinutes,
        boolean earlyDeparture,
        long earlyDepartureMinutes,
        BigDecimal totalHours,
        Provenance provenance,
        List<PunchKey> sourcePunches
) {
    public AttendanceRecord {
        Objects.requireNonNull(userId, "userId");
        Objects.requireNonNull(userType, "userType");
        Objects.requireNonNull(branchId, "branchId");
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(provenance, "provenance");
        totalHours = (totalHours == null ? BigDecimal.ZERO : totalHours).setScale(2, RoundingMode.HALF_UP);
        sourcePunches = sourcePunches == null ? List.of() : List.copyOf(sourcePunches);

        if (clockOutTime != null && (clockInTime == null || clockOutTime.isBefore(clockInTime))) {
            throw new IllegalArgumentException("clockOutTime requires an earlier or equal clockInTime");
        }
        if (lateMinutes < 0 || earlyDepartureMinutes < 0) {
            throw new IllegalArgumentException("minute counters must be non-negative");
        }
        if ((status == AttendanceStatus.ABSENT) != (clockInTime == null)) {
            throw new IllegalArgumentException("absent status must match a missing clock-in");
        }
        if ((status == AttendanceStatus.LATE) != late) {
            throw new IllegalArgumentException("late status must match the late flag");
        }
        if (status == AttendanceStatus.HALF_DAY && clockOutTime != null) {
            throw new IllegalArgumentException("half day requires a missing clock-out");
        }
        if (status == AttendanceStatus.EARLY_DEPARTURE && (!earlyDeparture || clockOutTime == null)) {
            throw new IllegalArgumentException("early departure status requires an early clock-out");
        }
        if (status == AttendanceStatus.PRESENT && earlyDeparture) {
            throw new IllegalArgumentException("present status cannot carry an early departure");
        }
    }

    public static AttendanceRecord absent(ResolvedIdentity identity, String branchId, LocalDate date, Provenance provenance) {
        return new AttendanceRecord(
                identity.userId(),
                identity.userType(),
                branchId,
                identity.classId(),
                date,
                null,
                null,
                AttendanceStatus.ABSENT,
                false,
                0,
                false,
                0,
                BigDecimal.ZERO,
                provenance,
                List.of()
        );
    }

    public PersonDay personDay() {
        return new PersonDay(userId, branchId, date);
    }
}
