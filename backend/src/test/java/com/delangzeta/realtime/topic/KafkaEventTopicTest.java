package com.delangzeta.realtime.topic;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.Header;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaEventTopicTest {

    @Mock
    KafkaTemplate<String, String> kafkaTemplate;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private KafkaEventTopic topic;

    @BeforeEach
    void setUp() {
        topic = new KafkaEventTopic(kafkaTemplate, objectMapper, "events", 1000);
    }

    @Test
    @DisplayName("attributes travel as headers, keyed by subject user")
    @SuppressWarnings("unchecked")
    void publishesWithHeaders() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.completedFuture(mock(SendResult.class)));

        topic.publish(InMemoryEventTopicTest.event("e1", "alice", EventKind.VALIDATION_UPDATE));

        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        ProducerRecord<String, String> record = captor.getValue();
        assertThat(record.key()).isEqualTo("alice");
        assertThat(header(record, EventAttributes.KIND)).isEqualTo("validation_update");
        assertThat(header(record, EventAttributes.SUBJECT_USER_ID)).isEqualTo("alice");
    }

    @Test
    @DisplayName("a failed send surfaces as TopicPublishException")
    @SuppressWarnings("unchecked")
    void failedSendThrows() {
        when(kafkaTemplate.send(any(ProducerRecord.class)))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("broker down")));

        assertThatThrownBy(() -> topic.publish(InMemoryEventTopicTest.event("e1", "alice", EventKind.TASK_UPDATE)))
                .isInstanceOf(TopicPublishException.class);
    }

    @Test
    @DisplayName("consumed records are filtered on headers and parsed back into events")
    void consumesAndFilters() {
        CanonicalEvent mine = InMemoryEventTopicTest.event("e2", "alice", EventKind.REWARD_DISTRIBUTED);
        CanonicalEvent other = InMemoryEventTopicTest.event("e3", "bob", EventKind.REWARD_DISTRIBUTED);

        StepVerifier.create(topic.subscribe(EventFilter.forUser("alice")))
                .then(() -> {
                    topic.onRecord(consumed(other));
                    topic.onRecord(consumed(mine));
                })
                .assertNext(e -> {
                    assertThat(e.getId()).isEqualTo("e2");
                    assertThat(e.getKind()).isEqualTo(EventKind.REWARD_DISTRIBUTED);
                    assertThat(e.getPayload()).containsEntry("action", "test");
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    private ConsumerRecord<String, String> consumed(CanonicalEvent event) {
        try {
            ConsumerRecord<String, String> record = new ConsumerRecord<>("events", 0, 0L,
                    event.getSubjectUserId(), objectMapper.writeValueAsString(event));
            EventAttributes.of(event).asMap()
                    .forEach((k, v) -> record.headers().add(k, v.getBytes(StandardCharsets.UTF_8)));
            return record;
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static String header(ProducerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
