package com.delangzeta.realtime.topic;

import com.delangzeta.realtime.domain.CanonicalEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Duration;

/**
 * Single-process topic on a multicast sink. Subscribers that cannot keep up miss events instead of
 * blocking publishers; nothing is retained for late subscribers.
 */
@Slf4j
public class InMemoryEventTopic implements EventTopic {

    private final Sinks.Many<Message> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(CanonicalEvent event) {
        sink.emitNext(new Message(EventAttributes.of(event), event),
                Sinks.EmitFailureHandler.busyLooping(Duration.ofSeconds(1)));
        log.debug("Published {} to {} subscribers", event.getId(), sink.currentSubscriberCount());
    }

    @Override
    public Flux<CanonicalEvent> subscribe(EventFilter filter) {
        return sink.asFlux()
                .filter(m -> filter.matches(m.attributes()))
                .map(Message::event);
    }

    private record Message(EventAttributes attributes, CanonicalEvent event) {
    }
}
