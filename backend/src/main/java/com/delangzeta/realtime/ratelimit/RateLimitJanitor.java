package com.delangzeta.realtime.ratelimit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Deletes expired counters in small batches. Expired counters are already ignored by the limiter, so a
 * failed run only delays cleanup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitJanitor {

    private final RateLimitStore store;
    private final RateLimitProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${realtime.rate-limit.janitor-interval-ms:60000}",
            initialDelayString = "${realtime.rate-limit.janitor-interval-ms:60000}")
    public void cleanup() {
        try {
            int removed = store.deleteExpired(clock.millis(), properties.getJanitorBatchSize());
            if (removed > 0) {
                log.info("Removed {} expired rate limit counters", removed);
            }
        } catch (RuntimeException e) {
            log.warn("Rate limit cleanup failed", e);
        }
    }
}
