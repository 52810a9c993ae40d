package com.delangzeta.realtime.ratelimit;

import com.delangzeta.realtime.domain.RateLimitScope;

/**
 * Keyed fixed-window counters. {@link #checkAndConsume} must be a single atomic read-modify-write per key:
 * <ul>
 *   <li>no counter, or window ended at or before now: count := 1, window [now, now + windowMs), allow;</li>
 *   <li>count &lt; limit: count + 1, allow;</li>
 *   <li>otherwise: reject and leave the counter untouched.</li>
 * </ul>
 */
public interface RateLimitStore {

    RateLimitDecision checkAndConsume(RateLimitScope scope, String identifier, int limit, long windowMs, long nowMs);

    /**
     * Removes up to {@code batchSize} counters whose window ended before {@code nowMs}.
     *
     * @return number of counters removed
     */
    int deleteExpired(long nowMs, int batchSize);
}
