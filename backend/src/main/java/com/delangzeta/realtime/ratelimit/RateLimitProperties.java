package com.delangzeta.realtime.ratelimit;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.rate-limit")
@NoArgsConstructor
@Getter
@Setter
public class RateLimitProperties {

    /** Requests per window for an authenticated user. Default 100. */
    private int perUser = 100;

    /** Requests per window for a client IP. Default 1000. */
    private int perIp = 1000;

    /** Window length in ms. Default 900000 (15 min). */
    private long windowMs = 900_000L;

    /** mongo (shared across instances, default) or memory. */
    private String store = "mongo";

    /** Janitor period in ms. Default 60000. */
    private long janitorIntervalMs = 60_000L;

    /** Max counters removed per janitor run. Default 100. */
    private int janitorBatchSize = 100;
}
