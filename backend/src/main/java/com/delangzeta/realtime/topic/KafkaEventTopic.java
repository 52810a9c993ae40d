package com.delangzeta.realtime.topic;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Durable topic on Kafka. Attributes travel as record headers and the record key is the subject user
 * (or the event id), so one user's events stay ordered within a partition. Consumed records are
 * re-emitted to local subscribers; payloads are parsed only for records that pass the filter.
 */
@Slf4j
public class KafkaEventTopic implements EventTopic {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topicName;
    private final long sendTimeoutMs;
    private final Sinks.Many<ConsumerRecord<String, String>> received = Sinks.many().multicast().directBestEffort();

    public KafkaEventTopic(KafkaTemplate<String, String> kafkaTemplate, ObjectMapper objectMapper,
                           String topicName, long sendTimeoutMs) {
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topicName = topicName;
        this.sendTimeoutMs = sendTimeoutMs;
    }

    @Override
    public void publish(CanonicalEvent event) {
        String json;
        try {
            json = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new TopicPublishException("Cannot serialize event " + event.getId(), e);
        }
        String key = event.getSubjectUserId() != null ? event.getSubjectUserId() : event.getId();
        ProducerRecord<String, String> record = new ProducerRecord<>(topicName, key, json);
        EventAttributes.of(event).asMap()
                .forEach((name, value) -> record.headers().add(name, value.getBytes(StandardCharsets.UTF_8)));
        try {
            kafkaTemplate.send(record).get(sendTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TopicPublishException("Interrupted while publishing " + event.getId(), e);
        } catch (ExecutionException | TimeoutException e) {
            throw new TopicPublishException("Kafka did not acknowledge " + event.getId(), e);
        }
    }

    @KafkaListener(topics = "${realtime.topic.name}", groupId = "${realtime.topic.group-id}")
    public void onRecord(ConsumerRecord<String, String> record) {
        received.emitNext(record, Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
    }

    @Override
    public Flux<CanonicalEvent> subscribe(EventFilter filter) {
        return received.asFlux()
                .filter(r -> filter.matches(EventAttributes.fromMap(headers(r.headers()))))
                .concatMap(r -> Mono.justOrEmpty(parse(r)));
    }

    private CanonicalEvent parse(ConsumerRecord<String, String> record) {
        try {
            return objectMapper.readValue(record.value(), CanonicalEvent.class);
        } catch (IOException e) {
            log.error("Unreadable event at {}-{}@{}", record.topic(), record.partition(), record.offset(), e);
            return null;
        }
    }

    private static Map<String, String> headers(Headers headers) {
        Map<String, String> map = new HashMap<>();
        for (Header header : headers) {
            map.put(header.key(), new String(header.value(), StandardCharsets.UTF_8));
        }
        return map;
    }
}
