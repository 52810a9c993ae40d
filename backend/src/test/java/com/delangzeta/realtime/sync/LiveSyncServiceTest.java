package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.topic.InMemoryEventTopic;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;

@ExtendWith(MockitoExtension.class)
class LiveSyncServiceTest {

    @Mock
    UserProfileLookup profileLookup;

    private final FakeChangeFeed changeFeed = new FakeChangeFeed();
    private final InMemoryEventTopic topic = new InMemoryEventTopic();
    private LiveSyncService service;

    @BeforeEach
    void setUp() {
        lenient().when(profileLookup.find("alice")).thenReturn(Optional.of(new UserProfile("alice", false, "user")));
        service = new LiveSyncService(new CollectionAccessPolicy(profileLookup), changeFeed, topic,
                Clock.fixed(Instant.parse("2025-03-01T00:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("one listener per visible (user, collection); user-owned listeners are filtered to the owner")
    void subscribeIsIdempotentAndScoped() {
        List<String> watched = service.subscribe("alice", List.of("tasks", "user_rewards", "validations"));
        service.subscribe("alice", List.of("tasks"));

        assertThat(watched).containsExactly("tasks", "user_rewards");
        assertThat(changeFeed.watches).containsExactly("tasks:*", "user_rewards:alice");
        assertThat(service.activeListenerCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("default collections are used when none are requested")
    void defaultCollections() {
        assertThat(service.subscribe("alice", null)).containsExactlyElementsOf(LiveSyncService.DEFAULT_COLLECTIONS);
    }

    @Test
    @DisplayName("a change is republished as an event addressed to the listening user")
    void changeBecomesUserEvent() {
        service.subscribe("alice", List.of("user_rewards"));

        StepVerifier.create(service.eventStream("alice"))
                .then(() -> changeFeed.emit(new DocumentChange("user_rewards", "r1", ChangeType.ADDED,
                        Map.of("userId", "alice", "amount", "5"), "{\"_data\": \"1\"}")))
                .assertNext(e -> {
                    assertThat(e.getKind()).isEqualTo(EventKind.REWARD_DISTRIBUTED);
                    assertThat(e.getPriority()).isEqualTo(EventPriority.HIGH);
                    assertThat(e.getSubjectUserId()).isEqualTo("alice");
                    assertThat(e.getPayload())
                            .containsEntry("changeType", "added")
                            .containsEntry("documentId", "r1")
                            .containsEntry("collection", "user_rewards");
                    assertThat(e.action()).isNotEqualTo("reward_distributed");
                })
                .thenCancel()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("unsubscribe and shutdown cancel every listener")
    void unsubscribeCancels() {
        service.subscribe("alice", List.of("tasks", "user_rewards"));
        service.subscribe("bob", List.of("tasks"));

        assertThat(service.unsubscribe("alice")).isEqualTo(2);
        assertThat(service.unsubscribe("alice")).isZero();
        service.shutdown();

        assertThat(changeFeed.cancelled).isEqualTo(3);
        assertThat(service.activeListenerCount()).isZero();
    }

    @Test
    void changeEventIdsDifferPerUser() {
        DocumentChange change = new DocumentChange("tasks", "t1", ChangeType.MODIFIED, Map.of(), "tok");
        Instant now = Instant.now();
        CanonicalEvent a = CollectionEvents.changeEvent("alice", change, now);
        CanonicalEvent b = CollectionEvents.changeEvent("bob", change, now);

        assertThat(a.getId()).isNotEqualTo(b.getId());
        assertThat(a.getTaskId()).isEqualTo("t1");
    }

    static class FakeChangeFeed implements CollectionChangeFeed {

        final List<String> watches = new ArrayList<>();
        final List<Consumer<DocumentChange>> listeners = new ArrayList<>();
        int cancelled;

        @Override
        public ChangeSubscription watch(String collection, String ownerUserId, Consumer<DocumentChange> listener) {
            watches.add(collection + ":" + (ownerUserId == null ? "*" : ownerUserId));
            listeners.add(listener);
            return () -> cancelled++;
        }

        void emit(DocumentChange change) {
            listeners.forEach(l -> l.accept(change));
        }
    }
}
