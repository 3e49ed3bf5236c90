package com.vaultoracle.common;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and ±20% jitter. Used for store connectivity at worker startup.
 */
@Slf4j
public final class RetryPolicy {

    private static final double JITTER_FACTOR = 0.2;

    private final long baseDelayMs;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.baseDelayMs = Math.max(0, baseDelayMs);
        this.maxAttempts = maxAttempts;
    }

    /**
     * Runs the action until it succeeds or attempts are exhausted. The last failure is the cause of the thrown exception.
     */
    public <T> T execute(String operation, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayMs(attempt - 1);
                log.warn("{} attempt {}/{} failed ({}), retrying in {} ms", operation, attempt, maxAttempts, e.getMessage(), delay);
                sleep(delay);
            }
        }
        throw new IllegalStateException(operation + " failed after " + maxAttempts + " attempts", last);
    }

    /**
     * Delay for the given zero-based attempt: baseDelay * 2^attempt with jitter.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * JITTER_FACTOR;
        return Math.max(0, (long) (exponential * jitter));
    }

    private static void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting to retry", e);
        }
    }
}
