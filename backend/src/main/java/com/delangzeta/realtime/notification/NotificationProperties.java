package com.delangzeta.realtime.notification;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    /** Subscribe fan-out to the event topic on startup. Default true. */
    private boolean enabled = true;

    /** Max drafts per bulk send, and buffer size for non-HIGH drafts. Default 100. */
    private int batchSize = 100;

    /** Max time a non-HIGH draft waits in the buffer. Default 2000. */
    private long batchDelayMs = 2000L;

    /** Per-send timeout against the push gateway. Default 5000. */
    private long sendTimeoutMs = 5000L;

    /** Max recipients of a broadcast (new task). Default 1000. */
    private int broadcastAudienceLimit = 1000;

    /** Push gateway endpoint; empty means log instead of sending. */
    private String gatewayUrl;

    /** Sent as "Authorization: key=..." when set. */
    private String gatewayApiKey;

    private String defaultIcon = "/icons/icon-192x192.png";

    private String defaultBadge = "/icons/badge-72x72.png";

    private String defaultTag = "delang-zeta";
}
