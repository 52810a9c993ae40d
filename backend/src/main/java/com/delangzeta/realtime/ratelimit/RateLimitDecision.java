package com.delangzeta.realtime.ratelimit;

/**
 * Outcome of one check. {@code resetTime} is the window end in epoch millis.
 */
public record RateLimitDecision(boolean allowed, int limit, int remaining, long resetTime) {

    public static RateLimitDecision allowed(int limit, int remaining, long resetTime) {
        return new RateLimitDecision(true, limit, remaining, resetTime);
    }

    public static RateLimitDecision rejected(int limit, long resetTime) {
        return new RateLimitDecision(false, limit, 0, resetTime);
    }

    /** Reset time in epoch seconds, as sent in X-RateLimit-Reset headers. */
    public long resetEpochSeconds() {
        return (resetTime + 999) / 1000;
    }

    /** Seconds until the window ends, at least 1. */
    public long retryAfterSeconds(long nowMs) {
        return Math.max(1, (resetTime - nowMs + 999) / 1000);
    }
}
