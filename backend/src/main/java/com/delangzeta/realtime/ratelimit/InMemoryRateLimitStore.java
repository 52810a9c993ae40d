package com.delangzeta.realtime.ratelimit;

import com.delangzeta.realtime.domain.RateLimitScope;

import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-process store. {@link ConcurrentHashMap#compute} runs the read-modify-write atomically per key.
 */
public class InMemoryRateLimitStore implements RateLimitStore {

    private final ConcurrentHashMap<String, Window> windows = new ConcurrentHashMap<>();

    @Override
    public RateLimitDecision checkAndConsume(RateLimitScope scope, String identifier, int limit, long windowMs, long nowMs) {
        RateLimitDecision[] decision = new RateLimitDecision[1];
        windows.compute(scope.counterId(identifier), (key, current) -> {
            if (current == null || current.windowEnd() <= nowMs) {
                decision[0] = RateLimitDecision.allowed(limit, limit - 1, nowMs + windowMs);
                return new Window(1, nowMs, nowMs + windowMs);
            }
            if (current.count() < limit) {
                int next = current.count() + 1;
                decision[0] = RateLimitDecision.allowed(limit, limit - next, current.windowEnd());
                return new Window(next, current.windowStart(), current.windowEnd());
            }
            decision[0] = RateLimitDecision.rejected(limit, current.windowEnd());
            return current;
        });
        return decision[0];
    }

    @Override
    public int deleteExpired(long nowMs, int batchSize) {
        int removed = 0;
        Iterator<Map.Entry<String, Window>> it = windows.entrySet().iterator();
        while (it.hasNext() && removed < batchSize) {
            Map.Entry<String, Window> entry = it.next();
            if (entry.getValue().windowEnd() < nowMs && windows.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    int size() {
        return windows.size();
    }

    private record Window(int count, long windowStart, long windowEnd) {
    }
}
