package com.polymind.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, capped at {@code maxDelayMs}. Attempts are unbounded; callers decide when to stop.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, long maxDelayMs) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException("baseDelayMs must be positive");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then jitter, then capped again.
     */
    public long delayMs(int attempt) {
        if (attempt <= 0) {
            return Math.min(maxDelayMs, jitter(baseDelayMs));
        }
        long exponential = baseDelayMs * (1L << Math.min(attempt, 20));
        return Math.min(maxDelayMs, jitter(Math.min(exponential, maxDelayMs)));
    }

    private long jitter(long value) {
        ThreadLocalRandom r = ThreadLocalRandom.current();
        double jitter = 1.0 + (r.nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * jitter));
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    /**
     * Default: 1s base, ±20% jitter, 60s cap.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 60_000L);
    }
}
