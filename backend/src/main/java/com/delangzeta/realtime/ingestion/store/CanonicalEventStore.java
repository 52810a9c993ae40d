package com.delangzeta.realtime.ingestion.store;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.CanonicalEventRepository;
import com.delangzeta.realtime.topic.EventTopic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Insert-if-absent store for canonical events keyed by their deterministic id, plus publication to the topic.
 * Each stored event carries a publish marker that is set only after the topic accepted it, so a duplicate
 * whose marker is still unset is published again instead of being dropped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CanonicalEventStore {

    public static final int MAX_HISTORY_LIMIT = 1000;

    private final CanonicalEventRepository repository;
    private final EventTopic eventTopic;

    /**
     * @return true when the event was newly stored, false when an event with the same id already exists
     */
    public boolean store(CanonicalEvent event) {
        try {
            repository.insert(event.toBuilder().published(false).build());
            return true;
        } catch (DuplicateKeyException e) {
            log.debug("Event {} already stored", event.getId());
            return false;
        }
    }

    /** Publishes to the topic, then records the publication. A failed publish leaves the marker unset. */
    public void publish(CanonicalEvent event) {
        eventTopic.publish(event);
        if (!repository.markPublished(event.getId())) {
            log.warn("Published event {} has no stored record to mark", event.getId());
        }
    }

    /**
     * Stores and publishes a new event, or republishes a stored one whose earlier publish never completed.
     * A publish failure propagates so the caller does not advance its cursor and retries later.
     *
     * @return true when the event was published by this call
     */
    public boolean storeAndPublish(CanonicalEvent event) {
        if (store(event)) {
            publish(event);
            return true;
        }
        return repository.findByIdAndPublishedFalse(event.getId())
                .map(stored -> {
                    log.info("Republishing event {} whose earlier publish did not complete", stored.getId());
                    publish(stored);
                    return true;
                })
                .orElse(false);
    }

    public List<CanonicalEvent> history(String eventName, Long fromBlock, Long toBlock, int limit) {
        int capped = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        return repository.findChainHistory(eventName, fromBlock, toBlock, capped);
    }
}
