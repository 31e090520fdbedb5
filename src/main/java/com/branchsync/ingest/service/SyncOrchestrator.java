package com.branchsync.ingest.service;

import com.branchsync.ingest.config.SyncProperties;
import com.branchsync.ingest.error.SyncException;
import com.branchsync.ingest.model.AttendanceRecord;
import com.branchsync.ingest.model.AttendanceType;
import com.branchsync.ingest.model.CommitFailure;
import com.branchsync.ingest.model.IngestBatch;
import com.branchsync.ingest.model.IngestResult;
import com.branchsync.ingest.model.PersonDay;
import com.branchsync.ingest.model.Provenance;
import com.branchsync.ingest.model.PunchKey;
import com.branchsync.ingest.model.RawPunchEvent;
import com.branchsync.ingest.model.RecordOutcome;
import com.branchsync.ingest.model.ResolvedIdentity;
import com.branchsync.ingest.model.ResolvedPunch;
import com.branchsync.ingest.model.SyncOutcome;
import com.branchsync.ingest.model.SyncResult;
import com.branchsync.ingest.model.UnresolvedIdentity;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Drives one sync cycle for a branch: extract, resolve identities, reconcile, commit
 * in batches, then move the watermark.
 *
 * <p>The watermark moves once per cycle, after every commit result is known, and
 * only up to the last committed punch that precedes the earliest punch that could
 * not be committed (a failed record, or an unresolved identity while holding is on).
 * Extraction uses a strict {@code >} on the watermark, so everything past it is read
 * again next cycle and the sink's person-day merge absorbs the overlap.</p>
 *
 * <p>Cycles for one branch never overlap. An interrupt cancels the cycle before the
 * watermark is written.</p>
 */
@Service
public class SyncOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);
    static final int MAX_TRACKED_BRANCHES = 1024;

    private final BranchRegistry branches;
    private final UserDirectory userDirectory;
    private final ReconciliationEngine engine;
    private final WorkingHoursPolicy workingHours;
    private final AttendanceSink sink;
    private final SyncCursorStore cursorStore;
    private final AttendanceRoster roster;
    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final int batchSize;
    private final Duration initialLookback;
    // weak values: a lock stays mapped for as long as a running cycle still holds it
    private final LoadingCache<String, ReentrantLock> locks = Caffeine.newBuilder()
            .weakValues()
            .build(branchId -> new ReentrantLock());
    private final Cache<String, SyncResult> lastResults = Caffeine.newBuilder()
            .maximumSize(MAX_TRACKED_BRANCHES)
            .build();

    public SyncOrchestrator(BranchRegistry branches,
                            UserDirectory userDirectory,
                            ReconciliationEngine engine,
                            WorkingHoursPolicy workingHours,
                            AttendanceSink sink,
                            SyncCursorStore cursorStore,
                            AttendanceRoster roster,
                            RetryPolicy retryPolicy,
                            Clock clock,
                            SyncProperties properties) {
        this.branches = branches;
        this.userDirectory = userDirectory;
        this.engine = engine;
        this.workingHours = workingHours;
        this.sink = sink;
        this.cursorStore = cursorStore;
        this.roster = roster;
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.batchSize = properties.getBatchSize();
        this.initialLookback = properties.getInitialLookback();
    }

    /**
     * Polls a configured branch once.
     *
     * @throws BranchRegistry.UnknownBranchException if the branch is not configured for polling
     * @throws com.branchsync.ingest.error.ReconciliationException on a reconciliation fault; nothing is committed
     */
    public SyncResult runOnce(String branchId) {
        BranchContext branch = branches.require(branchId);
        return locked(branchId, () -> poll(branch));
    }

    /**
     * Runs the same pipeline over logs a branch pushed to us instead of polling for them.
     */
    public SyncResult ingestPushed(String branchId, List<RawPunchEvent> events, AttendanceType attendanceType) {
        return locked(branchId, () -> {
            String batchId = newBatchId();
            Instant previous = cursorStore.getLastSyncTime(branchId).orElse(null);
            if (events == null || events.isEmpty()) {
                return SyncResult.noNewEvents(branchId, batchId, previous);
            }
            return process(branchId, branches.zoneFor(branchId), batchId, clock.instant(), previous, events, attendanceType);
        });
    }

    public Optional<SyncResult> lastResult(String branchId) {
        return Optional.ofNullable(lastResults.getIfPresent(branchId));
    }

    long trackedBranches() {
        lastResults.cleanUp();
        return lastResults.estimatedSize();
    }

    private SyncResult locked(String branchId, Supplier<SyncResult> cycle) {
        ReentrantLock lock = locks.get(branchId);
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return cancelled(branchId, null, cursorStore.getLastSyncTime(branchId).orElse(null));
        }
        try {
            SyncResult result = cycle.get();
            lastResults.put(branchId, result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    private SyncResult poll(BranchContext branch) {
        String branchId = branch.branchId();
        String batchId = newBatchId();
        Instant asOf = clock.instant();
        Optional<Instant> stored = cursorStore.getLastSyncTime(branchId);
        Instant previous = stored.orElse(null);
        Instant since = stored.orElseGet(() -> asOf.minus(initialLookback));

        List<RawPunchEvent> events;
        try {
            events = retryPolicy.execute("extract branch " + branchId,
                    () -> branch.extractor().extractSince(branchId, since));
        } catch (SyncException ex) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(branchId, batchId, previous);
            }
            log.warn("Branch {} extraction failed; watermark stays at {}: {}", branchId, previous, ex.getMessage());
            return SyncResult.aborted(branchId, batchId, SyncOutcome.EXTRACTION_FAILED, previous, ex.getMessage());
        }
        if (events.isEmpty()) {
            log.debug("Branch {} has no punches after {}", branchId, since);
            return SyncResult.noNewEvents(branchId, batchId, previous);
        }
        return process(branchId, branch.zone(), batchId, asOf, previous, events, AttendanceType.BIOMETRIC);
    }

    private SyncResult process(String branchId,
                               ZoneId zone,
                               String batchId,
                               Instant asOf,
                               Instant previous,
                               List<RawPunchEvent> events,
                               AttendanceType attendanceType) {
        List<RawPunchEvent> unique = dedupe(events);

        List<ResolvedPunch> punches;
        try {
            punches = resolve(branchId, unique);
        } catch (SyncException ex) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(branchId, batchId, previous);
            }
            log.warn("Branch {} identity lookup failed; watermark stays at {}: {}", branchId, previous, ex.getMessage());
            return SyncResult.aborted(branchId, batchId, SyncOutcome.IDENTITY_LOOKUP_FAILED, previous, ex.getMessage());
        }
        if (Thread.currentThread().isInterrupted()) {
            return cancelled(branchId, batchId, previous);
        }

        ReconciliationResult reconciled = engine.reconcile(
                new ReconciliationRequest(branchId, zone, punches, asOf, batchId, attendanceType));
        List<AttendanceRecord> records = new ArrayList<>(reconciled.records());
        records.addAll(absences(branchId, zone, asOf, batchId, attendanceType, reconciled.records()));

        Set<PersonDay> committedDays = new HashSet<>();
        Map<PersonDay, String> failedDays = new LinkedHashMap<>();
        for (int from = 0; from < records.size(); from += batchSize) {
            if (Thread.currentThread().isInterrupted()) {
                return cancelled(branchId, batchId, previous);
            }
            List<AttendanceRecord> chunk = records.subList(from, Math.min(records.size(), from + batchSize));
            IngestBatch batch = new IngestBatch(branchId, batchId, asOf, chunk);
            try {
                IngestResult result = retryPolicy.execute("commit branch " + branchId, () -> sink.ingest(batch));
                collectOutcomes(chunk, result, committedDays, failedDays);
            } catch (SyncException ex) {
                if (Thread.currentThread().isInterrupted()) {
                    return cancelled(branchId, batchId, previous);
                }
                log.warn("Branch {} commit of {} record(s) failed: {}", branchId, chunk.size(), ex.getMessage());
                chunk.forEach(record -> failedDays.put(record.personDay(), ex.getMessage()));
            }
        }

        int committedPunches = 0;
        int failedPunches = 0;
        int unresolvedPunches = 0;
        Instant earliestBlocked = null;
        List<Instant> passable = new ArrayList<>();
        for (ResolvedPunch punch : punches) {
            Instant timestamp = punch.event().timestamp();
            boolean blocked;
            if (!punch.resolved()) {
                // held so the punch is re-extracted once the directory knows the enroll number
                unresolvedPunches++;
                blocked = true;
            } else if (committedDays.contains(dayOf(punch, zone))) {
                committedPunches++;
                blocked = false;
            } else {
                failedPunches++;
                blocked = true;
            }
            if (blocked) {
                earliestBlocked = earliestBlocked == null || timestamp.isBefore(earliestBlocked) ? timestamp : earliestBlocked;
            } else {
                passable.add(timestamp);
            }
        }
        Instant limit = earliestBlocked;
        Instant candidate = passable.stream()
                .filter(timestamp -> limit == null || timestamp.isBefore(limit))
                .max(Comparator.naturalOrder())
                .orElse(null);

        if (Thread.currentThread().isInterrupted()) {
            return cancelled(branchId, batchId, previous);
        }
        Instant newWatermark = previous;
        String error = null;
        if (candidate != null && (previous == null || candidate.isAfter(previous))) {
            try {
                retryPolicy.run("advance cursor " + branchId,
                        () -> cursorStore.setLastSyncTime(branchId, candidate, batchId));
                newWatermark = candidate;
            } catch (SyncException ex) {
                log.error("Branch {} committed batch {} but the cursor could not be saved: {}", branchId, batchId, ex.getMessage(), ex);
                error = "cursor not saved: " + ex.getMessage();
            }
        }

        List<CommitFailure> failures = new ArrayList<>(failedDays.size());
        failedDays.forEach((day, message) -> failures.add(new CommitFailure(day, message)));
        SyncResult result = new SyncResult(
                branchId,
                batchId,
                SyncOutcome.COMPLETED,
                punches.size(),
                committedPunches,
                unresolvedPunches,
                failedPunches,
                committedDays.size(),
                failedDays.size(),
                previous,
                newWatermark,
                reconciled.unresolved(),
                failures,
                error
        );
        log.info("Branch {} batch {}: punches={} committed={} unresolved={} failed={} records={}/{} watermark {} -> {}",
                branchId, batchId, result.attempted(), result.committed(), result.unresolved(), result.failed(),
                result.committedRecords(), records.size(), previous, newWatermark);
        for (UnresolvedIdentity unresolved : reconciled.unresolved()) {
            log.warn("Branch {}: {}", branchId, unresolved.message());
        }
        return result;
    }

    private List<RawPunchEvent> dedupe(List<RawPunchEvent> events) {
        Map<PunchKey, RawPunchEvent> unique = new LinkedHashMap<>();
        for (RawPunchEvent event : events) {
            unique.putIfAbsent(event.key(), event);
        }
        List<RawPunchEvent> sorted = new ArrayList<>(unique.values());
        sorted.sort(Comparator.comparing(RawPunchEvent::timestamp));
        return sorted;
    }

    private List<ResolvedPunch> resolve(String branchId, List<RawPunchEvent> events) {
        Map<String, Optional<ResolvedIdentity>> lookups = new HashMap<>();
        List<ResolvedPunch> resolved = new ArrayList<>(events.size());
        for (RawPunchEvent event : events) {
            String key = event.enrollNumber() + "|" + Objects.toString(event.admissionNumber(), "");
            Optional<ResolvedIdentity> identity = lookups.computeIfAbsent(key, ignored -> retryPolicy.execute(
                    "resolve enroll " + event.enrollNumber() + " at branch " + branchId,
                    () -> userDirectory.resolveIdentity(branchId, event.enrollNumber(), event.admissionNumber())));
            resolved.add(new ResolvedPunch(event, identity.orElse(null)));
        }
        return resolved;
    }

    /**
     * Roster members with no record on a day the cycle touched, once their working day is over.
     */
    private List<AttendanceRecord> absences(String branchId,
                                            ZoneId zone,
                                            Instant asOf,
                                            String batchId,
                                            AttendanceType attendanceType,
                                            List<AttendanceRecord> observed) {
        Set<PersonDay> seen = new HashSet<>();
        TreeSet<LocalDate> dates = new TreeSet<>();
        for (AttendanceRecord record : observed) {
            seen.add(record.personDay());
            dates.add(record.date());
        }
        List<AttendanceRecord> absent = new ArrayList<>();
        Provenance provenance = new Provenance(attendanceType, null, batchId);
        for (LocalDate date : dates) {
            for (ResolvedIdentity identity : roster.expectedAttendees(branchId, date)) {
                Instant expectedEnd = date.atTime(workingHours.forUserType(identity.userType()).end()).atZone(zone).toInstant();
                if (asOf.isBefore(expectedEnd)) {
                    continue;
                }
                if (seen.add(new PersonDay(identity.userId(), branchId, date))) {
                    absent.add(AttendanceRecord.absent(identity, branchId, date, provenance));
                }
            }
        }
        return absent;
    }

    private void collectOutcomes(List<AttendanceRecord> chunk,
                                 IngestResult result,
                                 Set<PersonDay> committedDays,
                                 Map<PersonDay, String> failedDays) {
        Set<PersonDay> reported = new HashSet<>();
        for (RecordOutcome outcome : result.outcomes()) {
            reported.add(outcome.personDay());
            if (outcome.committed()) {
                committedDays.add(outcome.personDay());
            } else {
                failedDays.put(outcome.personDay(), outcome.error() == null ? "rejected by sink" : outcome.error());
            }
        }
        for (AttendanceRecord record : chunk) {
            if (!reported.contains(record.personDay())) {
                failedDays.put(record.personDay(), "sink reported no outcome");
            }
        }
    }

    private static PersonDay dayOf(ResolvedPunch punch, ZoneId zone) {
        return new PersonDay(punch.identity().userId(), punch.event().branchId(),
                punch.event().timestamp().atZone(zone).toLocalDate());
    }

    private static SyncResult cancelled(String branchId, String batchId, Instant watermark) {
        log.info("Branch {} cycle {} cancelled; watermark left at {}", branchId, batchId, watermark);
        return SyncResult.aborted(branchId, batchId, SyncOutcome.CANCELLED, watermark, "cancelled");
    }

    private static String newBatchId() {
        return "sync-" + UUID.randomUUID();
    }
}
