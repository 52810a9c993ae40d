package com.delangzeta.realtime.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Connector reconnect backoff (exponential ± jitter, capped). Retries never stop.
 */
@ConfigurationProperties(prefix = "realtime.ingestion.retry")
@NoArgsConstructor
@Getter
@Setter
public class IngestionRetryProperties {

    /** Base delay in ms for the first reconnect; doubles each attempt. Default 1000. */
    private long baseDelayMs = 1000L;

    /** Jitter factor 0..1 (e.g. 0.2 = ±20%). Default 0.2. */
    private double jitterFactor = 0.2;

    /** Upper bound for one delay. Default 30000. */
    private long maxDelayMs = 30_000L;
}
