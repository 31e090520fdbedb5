package com.branchsync.ingest.service;

import com.branchsync.ingest.error.ReconciliationException;
import com.branchsync.ingest.model.AttendanceRecord;
import com.branchsync.ingest.model.AttendanceStatus;
import com.branchsync.ingest.model.PersonDay;
import com.branchsync.ingest.model.Provenance;
import com.branchsync.ingest.model.PunchKey;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.ResolvedIdentity;
import com.branchsync.ingest.model.ResolvedPunch;
import com.branchsync.ingest.model.UnresolvedIdentity;
import com.branchsync.ingest.model.WorkingHours;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Folds raw punches into one attendance record per person and branch-local day.
 *
 * <p>The earliest punch of a day is the clock-in whatever direction the terminal
 * reported, and the latest is the clock-out once the day has at least two distinct
 * punches. Reported direction only orders punches that share a second. Output is a
 * pure function of the request: records come back ordered by day, branch and user,
 * and nothing reads the system clock.</p>
 */
@Service
public class ReconciliationEngine {
    private static final BigDecimal SECONDS_PER_HOUR = BigDecimal.valueOf(3600);

    private static final Comparator<ResolvedPunch> PUNCH_ORDER = Comparator
            .comparingLong((ResolvedPunch punch) -> punch.event().timestamp().getEpochSecond())
            .thenComparingInt(punch -> punch.event().direction().tieBreakRank())
            .thenComparing(punch -> punch.event().timestamp())
            .thenComparing(punch -> punch.event().sourceDeviceId())
            .thenComparing(punch -> punch.event().enrollNumber());

    private final WorkingHoursPolicy workingHours;

    public ReconciliationEngine(WorkingHoursPolicy workingHours) {
        this.workingHours = workingHours;
    }

    public ReconciliationResult reconcile(ReconciliationRequest request) {
        Map<PunchKey, ResolvedPunch> unique = new LinkedHashMap<>();
        for (ResolvedPunch punch : request.punches()) {
            RawPunchEvent event = punch.event();
            if (!request.branchId().equals(event.branchId())) {
                throw new ReconciliationException("Punch " + event.key() + " does not belong to branch " + request.branchId());
            }
            ResolvedPunch previous = unique.putIfAbsent(event.key(), punch);
            if (previous != null && !Objects.equals(previous.identity(), punch.identity())) {
                throw new ReconciliationException("Punch " + event.key() + " resolved to two identities: "
                        + previous.identity() + " and " + punch.identity());
            }
        }

        TreeMap<PersonDay, List<ResolvedPunch>> groups = new TreeMap<>();
        TreeMap<PunchKey, UnresolvedIdentity> unresolved = new TreeMap<>();
        for (ResolvedPunch punch : unique.values()) {
            RawPunchEvent event = punch.event();
            if (!punch.resolved()) {
                unresolved.put(event.key(), UnresolvedIdentity.of(event));
                continue;
            }
            LocalDate date = event.timestamp().atZone(request.zone()).toLocalDate();
            PersonDay day = new PersonDay(punch.identity().userId(), request.branchId(), date);
            groups.computeIfAbsent(day, key -> new ArrayList<>()).add(punch);
        }

        List<AttendanceRecord> records = new ArrayList<>(groups.size());
        groups.forEach((day, punches) -> records.add(fold(day, punches, request)));
        return new ReconciliationResult(records, new ArrayList<>(unresolved.values()));
    }

    /**
     * Folds a newly reconciled record into the one already stored for the same person-day.
     * Observed punches always win over a synthesized absence, and the union of both
     * records' punches decides clock-in and clock-out.
     */
    public AttendanceRecord merge(AttendanceRecord existing, AttendanceRecord incoming, ZoneId zone, Instant asOf) {
        if (!existing.personDay().equals(incoming.personDay())) {
            throw new ReconciliationException("Cannot merge " + incoming.personDay() + " into " + existing.personDay());
        }
        if (existing.clockInTime() == null) {
            return incoming;
        }
        if (incoming.clockInTime() == null) {
            return existing;
        }
        TreeSet<PunchKey> punches = new TreeSet<>(existing.sourcePunches());
        punches.addAll(incoming.sourcePunches());
        TreeSet<Instant> times = new TreeSet<>();
        addIfPresent(times, existing.clockInTime());
        addIfPresent(times, existing.clockOutTime());
        addIfPresent(times, incoming.clockInTime());
        addIfPresent(times, incoming.clockOutTime());

        Instant clockIn = times.first();
        boolean paired = Math.max(punches.size(), times.size()) >= 2;
        Instant clockOut = paired ? times.last() : null;
        ResolvedIdentity identity = new ResolvedIdentity(incoming.userId(), incoming.userType(), incoming.classId());
        return derive(identity, incoming.branchId(), incoming.date(), clockIn, clockOut,
                incoming.provenance(), new ArrayList<>(punches), zone, asOf);
    }

    private AttendanceRecord fold(PersonDay day, List<ResolvedPunch> punches, ReconciliationRequest request) {
        List<ResolvedPunch> ordered = new ArrayList<>(punches);
        ordered.sort(PUNCH_ORDER);

        ResolvedIdentity identity = ordered.get(0).identity();
        for (ResolvedPunch punch : ordered) {
            ResolvedIdentity other = punch.identity();
            if (other.userType() != identity.userType() || !Objects.equals(other.classId(), identity.classId())) {
                throw new ReconciliationException("User " + day.userId() + " resolved inconsistently on " + day.date()
                        + ": " + identity + " vs " + other);
            }
        }

        ResolvedPunch first = ordered.get(0);
        ResolvedPunch last = ordered.get(ordered.size() - 1);
        Instant clockIn = first.event().timestamp();
        Instant clockOut = ordered.size() >= 2 ? last.event().timestamp() : null;
        if (clockOut != null && clockOut.isBefore(clockIn)) {
            // same second, direction put an OUT after a later-nanosecond IN
            clockOut = clockIn;
        }

        List<PunchKey> sourcePunches = ordered.stream().map(punch -> punch.event().key()).sorted().toList();
        Provenance provenance = new Provenance(request.attendanceType(), first.event().sourceDeviceId(), request.syncBatchId());
        return derive(identity, day.branchId(), day.date(), clockIn, clockOut, provenance, sourcePunches,
                request.zone(), request.asOf());
    }

    private AttendanceRecord derive(ResolvedIdentity identity,
                                    String branchId,
                                    LocalDate date,
                                    Instant clockIn,
                                    Instant clockOut,
                                    Provenance provenance,
                                    List<PunchKey> sourcePunches,
                                    ZoneId zone,
                                    Instant asOf) {
        WorkingHours hours = workingHours.forUserType(identity.userType());
        Instant lateThreshold = date.atTime(hours.lateThreshold()).atZone(zone).toInstant();
        Instant expectedEnd = date.atTime(hours.end()).atZone(zone).toInstant();

        boolean late = clockIn.isAfter(lateThreshold);
        long lateMinutes = late ? Duration.between(lateThreshold, clockIn).toMinutes() : 0;
        boolean early = clockOut != null && clockOut.isBefore(expectedEnd);
        long earlyMinutes = early ? Duration.between(clockOut, expectedEnd).toMinutes() : 0;
        boolean shiftEnded = !asOf.isBefore(expectedEnd);

        AttendanceStatus status = AttendanceStatus.derive(true, clockOut != null, late, early, shiftEnded);
        BigDecimal totalHours = clockOut == null
                ? BigDecimal.ZERO
                : BigDecimal.valueOf(Duration.between(clockIn, clockOut).getSeconds())
                        .divide(SECONDS_PER_HOUR, 2, RoundingMode.HALF_UP);

        return new AttendanceRecord(
                identity.userId(),
                identity.userType(),
                branchId,
                identity.classId(),
                date,
                clockIn,
                clockOut,
                status,
                late,
                lateMinutes,
                early,
                earlyMinutes,
                totalHours,
                provenance,
                sourcePunches
        );
    }

    private static void addIfPresent(TreeSet<Instant> times, Instant value) {
        if (value != null) {
            times.add(value);
        }
    }
}
