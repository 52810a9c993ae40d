package com.delangzeta.realtime.topic;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "realtime.topic")
@NoArgsConstructor
@Getter
@Setter
public class TopicProperties {

    /** memory (single process, default) or kafka. */
    private String type = "memory";

    /** Kafka topic name. */
    private String name = "delangzeta-realtime-events";

    /** Kafka consumer group shared by all instances. */
    private String groupId = "delangzeta-realtime";

    /** Max wait for a Kafka acknowledgement. Default 10000. */
    private long sendTimeoutMs = 10_000L;
}
