package com.delangzeta.realtime.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter and an upper bound, used for connector reconnects.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, long maxDelayMs) {
        if (baseDelayMs <= 0 || maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException("baseDelayMs must be positive and not above maxDelayMs");
        }
        if (jitterFactor < 0 || jitterFactor >= 1) {
            throw new IllegalArgumentException("jitterFactor must be in [0, 1)");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Delay in milliseconds for the given zero-based attempt.
     * Formula: min(baseDelay * 2^attempt, maxDelay), then jitter; the result never exceeds maxDelay.
     */
    public long delayMs(int attempt) {
        int shift = Math.max(0, Math.min(attempt, 30));
        long exponential = baseDelayMs << shift;
        if (exponential <= 0 || exponential > maxDelayMs) {
            exponential = maxDelayMs;
        }
        return Math.min(maxDelayMs, jitter(exponential));
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
     * Default: 1s base, ±20% jitter, capped at 30s.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(1000L, 0.2, 30_000L);
    }
}
