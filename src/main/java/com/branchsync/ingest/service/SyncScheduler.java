package com.branchsync.ingest.service;

import com.branchsync.ingest.config.SyncProperties;
import com.branchsync.ingest.error.ReconciliationException;
import com.branchsync.ingest.model.SyncResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Continuous mode: one worker thread per branch running {@link SyncOrchestrator#runOnce}
 * with a fixed delay, so a hung device or database only stalls its own branch.
 *
 * <p>A reconciliation fault suspends that branch's schedule instead of repeating the
 * same failure every interval.</p>
 */
@Component
public class SyncScheduler {
    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);
    private static final Duration INITIAL_DELAY = Duration.ofSeconds(2);

    private final SyncOrchestrator orchestrator;
    private final BranchRegistry branches;
    private final SyncProperties properties;
    private final Map<String, ScheduledExecutorService> workers = new ConcurrentHashMap<>();
    private final Map<String, ScheduledFuture<?>> schedules = new ConcurrentHashMap<>();
    private final Set<String> suspended = ConcurrentHashMap.newKeySet();

    public SyncScheduler(SyncOrchestrator orchestrator, BranchRegistry branches, SyncProperties properties) {
        this.orchestrator = orchestrator;
        this.branches = branches;
        this.properties = properties;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.isSchedulerEnabled()) {
            log.info("Continuous sync disabled; manual triggers only");
            return;
        }
        start();
    }

    public void start() {
        for (BranchContext branch : branches.all()) {
            String branchId = branch.branchId();
            ScheduledExecutorService worker = workers.computeIfAbsent(branchId, id -> Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "sync-" + id);
                thread.setDaemon(true);
                return thread;
            }));
            schedules.computeIfAbsent(branchId, id -> worker.scheduleWithFixedDelay(() -> runCycle(id),
                    INITIAL_DELAY.toMillis(), properties.getInterval().toMillis(), TimeUnit.MILLISECONDS));
            log.info("Scheduled branch {} ({}) every {}", branchId, branch.name(), properties.getInterval());
        }
    }

    public boolean isSuspended(String branchId) {
        return suspended.contains(branchId);
    }

    void runCycle(String branchId) {
        if (suspended.contains(branchId)) {
            return;
        }
        try {
            SyncResult result = orchestrator.runOnce(branchId);
            log.debug("Branch {} cycle finished with {}", branchId, result.outcome());
        } catch (ReconciliationException ex) {
            suspended.add(branchId);
            ScheduledFuture<?> schedule = schedules.remove(branchId);
            if (schedule != null) {
                schedule.cancel(false);
            }
            log.error("Branch {} suspended after a reconciliation fault; fix the data and restart", branchId, ex);
        } catch (RuntimeException ex) {
            // an escaping exception cancels the fixed-delay schedule
            log.error("Branch {} cycle failed unexpectedly", branchId, ex);
        }
    }

    @PreDestroy
    public void shutdown() {
        schedules.values().forEach(schedule -> schedule.cancel(true));
        workers.values().forEach(ScheduledExecutorService::shutdownNow);
        for (Map.Entry<String, ScheduledExecutorService> entry : workers.entrySet()) {
            try {
                if (!entry.getValue().awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Sync worker for branch {} did not stop within 5s", entry.getKey());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
