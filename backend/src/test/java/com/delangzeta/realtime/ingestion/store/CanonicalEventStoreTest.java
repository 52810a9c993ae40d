package com.delangzeta.realtime.ingestion.store;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.CanonicalEventRepository;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.topic.EventTopic;
import com.delangzeta.realtime.topic.TopicPublishException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CanonicalEventStoreTest {

    @Mock
    CanonicalEventRepository repository;
    @Mock
    EventTopic eventTopic;
    @InjectMocks
    CanonicalEventStore store;

    @Test
    @DisplayName("an event ingested twice is stored and published exactly once")
    void idempotentIngestion() {
        CanonicalEvent event = event("zetachain:0xabc:0");
        when(repository.insert(event))
                .thenReturn(event)
                .thenThrow(new DuplicateKeyException("E11000 duplicate key"));

        when(repository.markPublished(event.getId())).thenReturn(true);

        assertThat(store.storeAndPublish(event)).isTrue();
        assertThat(store.storeAndPublish(event)).isFalse();

        verify(eventTopic, times(1)).publish(event);
        verify(repository).markPublished(event.getId());
    }

    @Test
    @DisplayName("an event whose publish failed after storage is published when ingested again")
    void unpublishedDuplicateIsRepublished() {
        CanonicalEvent event = event("zetachain:0xdef:3");
        CanonicalEvent stored = event.toBuilder().published(false).build();
        when(repository.insert(any(CanonicalEvent.class)))
                .thenReturn(stored)
                .thenThrow(new DuplicateKeyException("E11000 duplicate key"));
        doThrow(new TopicPublishException("broker down", new IllegalStateException("connection refused")))
                .doNothing()
                .when(eventTopic).publish(any(CanonicalEvent.class));
        when(repository.findByIdAndPublishedFalse(event.getId()))
                .thenReturn(Optional.of(stored))
                .thenReturn(Optional.empty());
        when(repository.markPublished(event.getId())).thenReturn(true);

        assertThatThrownBy(() -> store.storeAndPublish(event)).isInstanceOf(TopicPublishException.class);
        assertThat(store.storeAndPublish(event)).isTrue();
        assertThat(store.storeAndPublish(event)).isFalse();

        verify(eventTopic, times(2)).publish(any(CanonicalEvent.class));
        verify(repository, times(1)).markPublished(event.getId());
    }

    @Test
    @DisplayName("a stored event starts with its publish marker unset")
    void insertsWithMarkerUnset() {
        CanonicalEvent event = event("zetachain:0x123:1");
        when(repository.insert(any(CanonicalEvent.class))).thenAnswer(inv -> inv.getArgument(0));
        when(repository.markPublished(event.getId())).thenReturn(true);

        store.storeAndPublish(event);

        ArgumentCaptor<CanonicalEvent> inserted = ArgumentCaptor.forClass(CanonicalEvent.class);
        verify(repository).insert(inserted.capture());
        assertThat(inserted.getValue().getPublished()).isFalse();
    }

    @Test
    @DisplayName("history limit is capped at 1000")
    void historyLimitCapped() {
        when(repository.findChainHistory(eq("RewardDistributedOmnichain"), any(), any(), anyInt())).thenReturn(List.of());

        store.history("RewardDistributedOmnichain", null, null, 50_000);

        verify(repository).findChainHistory("RewardDistributedOmnichain", null, null, CanonicalEventStore.MAX_HISTORY_LIMIT);
    }

    private static CanonicalEvent event(String id) {
        return CanonicalEvent.builder()
                .id(id)
                .kind(EventKind.BLOCKCHAIN_EVENT)
                .priority(EventPriority.LOW)
                .payload(Map.of("action", "contract_event"))
                .observedAt(Instant.parse("2025-03-01T12:00:00Z"))
                .build();
    }
}
