package com.delangzeta.realtime.topic;

import com.delangzeta.realtime.domain.CanonicalEvent;
import reactor.core.publisher.Flux;

/**
 * Fan-out channel for canonical events. Delivery is at-least-once; consumers dedupe on event id.
 */
public interface EventTopic {

    /**
     * Returns once the event is accepted by the topic. Throws {@link TopicPublishException} otherwise.
     */
    void publish(CanonicalEvent event);

    /**
     * Hot stream of events published after subscription whose attributes match the filter.
     */
    Flux<CanonicalEvent> subscribe(EventFilter filter);
}
