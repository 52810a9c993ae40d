package com.delangzeta.realtime.ratelimit;

import com.delangzeta.realtime.domain.RateLimitScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Per-identity fixed-window limiter over a shared {@link RateLimitStore}. When the store fails the request
 * is allowed: availability of the API wins over strict limiting.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DistributedRateLimiter {

    private final RateLimitStore store;
    private final RateLimitProperties properties;
    private final Clock clock;

    public RateLimitDecision checkAndConsume(String identifier, RateLimitScope scope, int limit, long windowMs) {
        if (limit <= 0 || windowMs <= 0) {
            throw new IllegalArgumentException("limit and windowMs must be positive");
        }
        long now = clock.millis();
        try {
            return store.checkAndConsume(scope, identifier, limit, windowMs, now);
        } catch (RuntimeException e) {
            log.warn("Rate limit store failed for {} {}; allowing request", scope, identifier, e);
            return RateLimitDecision.allowed(limit, limit - 1, now + windowMs);
        }
    }

    public RateLimitDecision checkIp(String ip) {
        return checkAndConsume(ip, RateLimitScope.IP, properties.getPerIp(), properties.getWindowMs());
    }

    public RateLimitDecision checkUser(String userId) {
        return checkAndConsume(userId, RateLimitScope.USER, properties.getPerUser(), properties.getWindowMs());
    }

    public long nowMs() {
        return clock.millis();
    }
}
