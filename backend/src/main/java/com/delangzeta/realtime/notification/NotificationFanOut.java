package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.config.CaffeineConfig;
import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.domain.NotificationPreference;
import com.delangzeta.realtime.notification.mapping.NotificationMapper;
import com.delangzeta.realtime.notification.mapping.NotificationMapperRegistry;
import com.delangzeta.realtime.topic.EventFilter;
import com.delangzeta.realtime.topic.EventTopic;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Topic consumer that turns events into notifications. Redelivered events are dropped by id; preferences
 * are checked before any device token is looked up. HIGH drafts go out immediately, the rest are buffered
 * into bulk sends.
 */
@Slf4j
@Component
public class NotificationFanOut {

    private static final int MAX_CONCURRENT_BATCHES = 4;

    private final EventTopic eventTopic;
    private final NotificationMapperRegistry mappers;
    private final NotificationPreferenceService preferenceService;
    private final NotificationDispatcher dispatcher;
    private final NotificationProperties properties;
    private final Cache processedEvents;
    private Disposable subscription;

    public NotificationFanOut(EventTopic eventTopic, NotificationMapperRegistry mappers,
                              NotificationPreferenceService preferenceService, NotificationDispatcher dispatcher,
                              NotificationProperties properties, CacheManager cacheManager) {
        this.eventTopic = eventTopic;
        this.mappers = mappers;
        this.preferenceService = preferenceService;
        this.dispatcher = dispatcher;
        this.properties = properties;
        this.processedEvents = Objects.requireNonNull(cacheManager.getCache(CaffeineConfig.PROCESSED_EVENT_CACHE),
                "processed event cache");
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (!properties.isEnabled() || subscription != null) {
            return;
        }
        subscription = process(eventTopic.subscribe(EventFilter.all()))
                .subscribe(sent -> log.debug("Notification batch delivered {}", sent),
                        error -> log.error("Notification fan-out stopped", error));
        log.info("Notification fan-out subscribed");
    }

    @PreDestroy
    public synchronized void stop() {
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
    }

    /**
     * Full pipeline: draft, split by priority, batch, dispatch. Emits the delivered count per dispatched batch.
     */
    Flux<Integer> process(Flux<CanonicalEvent> events) {
        Duration delay = Duration.ofMillis(properties.getBatchDelayMs());
        int batchSize = Math.max(1, properties.getBatchSize());
        return events
                .onBackpressureBuffer()
                .publishOn(Schedulers.boundedElastic())
                .concatMapIterable(this::draftsForSafely)
                .groupBy(d -> d.priority() == EventPriority.HIGH)
                .flatMap(group -> Boolean.TRUE.equals(group.key())
                        ? group.map(List::of)
                        : group.bufferTimeout(batchSize, delay))
                .flatMap(batch -> Mono.fromCallable(() -> dispatcher.sendBulk(batch))
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            log.warn("Notification batch of {} failed", batch.size(), e);
                            return Mono.just(0);
                        }), MAX_CONCURRENT_BATCHES);
    }

    /**
     * Drafts for one event after dedup, mapping and preference checks. Returns nothing for an event id
     * seen within the dedup window. The id is only remembered once drafting succeeds, so a redelivery after
     * a failure is processed again.
     */
    public List<NotificationDraft> draftsFor(CanonicalEvent event) {
        if (processedEvents.putIfAbsent(event.getId(), Boolean.TRUE) != null) {
            log.debug("Event {} already fanned out", event.getId());
            return List.of();
        }
        try {
            return buildDrafts(event);
        } catch (RuntimeException e) {
            processedEvents.evict(event.getId());
            throw e;
        }
    }

    private List<NotificationDraft> buildDrafts(CanonicalEvent event) {
        Optional<NotificationMapper> mapper = mappers.forKind(event.getKind()).filter(m -> m.supports(event));
        if (mapper.isEmpty()) {
            return List.of();
        }
        NotificationCategory category = NotificationCategory.of(event.getKind());
        List<String> recipients;
        if (event.getSubjectUserId() != null) {
            recipients = List.of(event.getSubjectUserId());
        } else if (mapper.get().broadcast()) {
            recipients = preferenceService.taskBroadcastAudience(properties.getBroadcastAudienceLimit());
        } else {
            return List.of();
        }
        List<NotificationDraft> drafts = new ArrayList<>();
        for (String userId : recipients) {
            NotificationPreference preference = preferenceService.get(userId);
            if (!category.isEnabled(preference)) {
                log.debug("{} notifications disabled for {}", category, userId);
                continue;
            }
            drafts.add(mapper.get().draft(event, userId));
        }
        return drafts;
    }

    /**
     * Ad-hoc send (test notifications). Honors the push switch only.
     */
    public boolean sendDirect(NotificationDraft draft) {
        if (!preferenceService.get(draft.userId()).isEnablePushNotifications()) {
            log.debug("Push disabled for {}", draft.userId());
            return false;
        }
        return dispatcher.send(draft);
    }

    private List<NotificationDraft> draftsForSafely(CanonicalEvent event) {
        try {
            return draftsFor(event);
        } catch (RuntimeException e) {
            log.warn("Could not build notifications for event {}; a redelivery is processed again", event.getId(), e);
            return List.of();
        }
    }
}
