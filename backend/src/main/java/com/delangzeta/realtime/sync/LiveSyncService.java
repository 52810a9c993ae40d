package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.topic.EventFilter;
import com.delangzeta.realtime.topic.EventTopic;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user live listeners: one change feed subscription per visible (user, collection), each change
 * republished as a canonical event addressed to that user.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LiveSyncService {

    public static final List<String> DEFAULT_COLLECTIONS = List.of(
            "tasks", "user_submissions", "user_validations", "user_rewards", "user_notifications");

    private final CollectionAccessPolicy accessPolicy;
    private final CollectionChangeFeed changeFeed;
    private final EventTopic eventTopic;
    private final Clock clock;
    private final Map<String, Map<String, CollectionChangeFeed.ChangeSubscription>> subscriptions = new ConcurrentHashMap<>();

    /**
     * Registers listeners; calling again for an already watched collection is a no-op.
     *
     * @return the collections now watched for this call (invisible ones dropped)
     */
    public List<String> subscribe(String userId, List<String> requestedCollections) {
        List<String> collections = requestedCollections == null || requestedCollections.isEmpty()
                ? DEFAULT_COLLECTIONS
                : new ArrayList<>(new LinkedHashSet<>(requestedCollections));
        Map<String, CollectionChangeFeed.ChangeSubscription> mine =
                subscriptions.computeIfAbsent(userId, k -> new ConcurrentHashMap<>());
        List<String> watched = new ArrayList<>();
        for (String collection : collections) {
            if (!accessPolicy.canRead(userId, collection)) {
                log.debug("User {} cannot watch {}; skipped", userId, collection);
                continue;
            }
            String owner = accessPolicy.classify(collection) == CollectionAccess.USER_OWNED ? userId : null;
            mine.computeIfAbsent(collection, c -> changeFeed.watch(c, owner, change -> onChange(userId, change)));
            watched.add(collection);
        }
        log.info("Live listeners for {}: {}", userId, mine.keySet());
        return watched;
    }

    /**
     * @return number of listeners cancelled
     */
    public int unsubscribe(String userId) {
        Map<String, CollectionChangeFeed.ChangeSubscription> mine = subscriptions.remove(userId);
        if (mine == null) {
            return 0;
        }
        mine.values().forEach(CollectionChangeFeed.ChangeSubscription::cancel);
        return mine.size();
    }

    public Flux<CanonicalEvent> eventStream(String userId) {
        return eventTopic.subscribe(EventFilter.forUser(userId));
    }

    public int activeListenerCount() {
        return subscriptions.values().stream().mapToInt(Map::size).sum();
    }

    @PreDestroy
    public void shutdown() {
        new ArrayList<>(subscriptions.keySet()).forEach(this::unsubscribe);
    }

    void onChange(String userId, DocumentChange change) {
        CanonicalEvent event = CollectionEvents.changeEvent(userId, change, Instant.now(clock));
        try {
            eventTopic.publish(event);
        } catch (RuntimeException e) {
            log.warn("Could not publish change {} of {}/{} for {}", change.changeType(), change.collection(),
                    change.documentId(), userId, e);
        }
    }
}
