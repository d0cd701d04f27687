package com.coinledger.common;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Exponential backoff with jitter for explorer and indexer calls.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt + 1}: baseDelay * 2^attempt with jitter applied.
     */
    public long delayMs(int attempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(attempt, 0), 20));
        double jitter = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (exponential * jitter));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code call} until it succeeds, the error is not retryable or attempts run out.
     * The last failure is rethrown unchanged.
     */
    public <T> T execute(Supplier<T> call, Predicate<RuntimeException> retryable) {
        RuntimeException last = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            if (attempt > 0) {
                sleep(delayMs(attempt - 1));
            }
            try {
                return call.get();
            } catch (RuntimeException e) {
                last = e;
                if (!retryable.test(e)) {
                    throw e;
                }
            }
        }
        throw last;
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted during retry backoff", e);
        }
    }

    /**
     * Default: 1s base, 20% jitter, 3 attempts.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 3);
    }
}
