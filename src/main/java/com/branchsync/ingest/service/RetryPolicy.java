package com.branchsync.ingest.service;

import com.branchsync.ingest.config.SyncProperties;
import com.branchsync.ingest.error.SyncException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with capped exponential backoff, shared by device connect,
 * extraction and sink commits. Only {@link SyncException}s that report
 * {@code retryable()} are retried; anything else propagates immediately.
 *
 * <p>An interrupt while backing off stops retrying: the interrupt flag is restored
 * and the last failure is rethrown.</p>
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoff.toMillis());
        this.maxBackoffMs = Math.max(initialBackoffMs, maxBackoff.toMillis());
        this.sleeper = sleeper;
    }

    public static RetryPolicy from(SyncProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMaxBackoff(), Thread::sleep);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, millis -> { });
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int attempts = 0;
        while (true) {
            attempts++;
            try {
                return action.get();
            } catch (SyncException ex) {
                if (!ex.retryable() || attempts >= maxAttempts || Thread.currentThread().isInterrupted()) {
                    throw ex;
                }
                long delay = backoffDelayMs(attempts);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}",
                        operation, attempts, maxAttempts, delay, ex.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    throw ex;
                }
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    long backoffDelayMs(int attempt) {
        long delay = initialBackoffMs * (1L << Math.min(16, attempt - 1));
        return Math.min(delay, maxBackoffMs);
    }
}
