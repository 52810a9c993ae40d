package com.delangzeta.realtime.topic;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

@Configuration
@EnableConfigurationProperties(TopicProperties.class)
public class TopicConfig {

    @Bean
    @ConditionalOnProperty(name = "realtime.topic.type", havingValue = "memory", matchIfMissing = true)
    public EventTopic inMemoryEventTopic() {
        return new InMemoryEventTopic();
    }

    @Bean
    @ConditionalOnProperty(name = "realtime.topic.type", havingValue = "kafka")
    public EventTopic kafkaEventTopic(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                                      TopicProperties properties) {
        return new KafkaEventTopic(kafkaTemplate, objectMapper, properties.getName(), properties.getSendTimeoutMs());
    }
}
