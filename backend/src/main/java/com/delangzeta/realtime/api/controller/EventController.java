package com.delangzeta.realtime.api.controller;

import com.delangzeta.realtime.api.dto.PublishEventRequest;
import com.delangzeta.realtime.api.dto.PublishEventResponse;
import com.delangzeta.realtime.api.filter.RequestUsers;
import com.delangzeta.realtime.auth.AccessDeniedException;
import com.delangzeta.realtime.auth.AuthenticatedUser;
import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.ingestion.store.CanonicalEventStore;
import com.delangzeta.realtime.sync.LiveSyncService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * GET /events/stream (server-sent events for the caller) and POST /events/publish (admin only).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@RequiredArgsConstructor
public class EventController {

    static final Duration HEARTBEAT = Duration.ofSeconds(30);

    private final LiveSyncService liveSyncService;
    private final CanonicalEventStore eventStore;
    private final Clock clock;

    @GetMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<CanonicalEvent>> stream(ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        Flux<ServerSentEvent<CanonicalEvent>> events = liveSyncService.eventStream(userId)
                .map(e -> ServerSentEvent.builder(e).id(e.getId()).event(e.getKind().wireName()).build());
        Flux<ServerSentEvent<CanonicalEvent>> heartbeat = Flux.interval(HEARTBEAT)
                .map(i -> ServerSentEvent.<CanonicalEvent>builder().comment("heartbeat").build());
        return Flux.merge(events, heartbeat)
                .doOnSubscribe(s -> log.debug("Event stream opened for {}", userId))
                .doFinally(signal -> log.debug("Event stream for {} closed ({})", userId, signal));
    }

    @PostMapping("/publish")
    public Mono<ResponseEntity<PublishEventResponse>> publish(@Valid @RequestBody PublishEventRequest request,
                                                              ServerWebExchange exchange) {
        AuthenticatedUser caller = RequestUsers.require(exchange);
        if (!caller.hasPermission(AuthenticatedUser.ADMIN)) {
            throw new AccessDeniedException("Publishing events requires admin permission");
        }
        CanonicalEvent event = toEvent(request);
        return Mono.fromCallable(() -> eventStore.storeAndPublish(event))
                .subscribeOn(Schedulers.boundedElastic())
                .map(published -> ResponseEntity.ok(new PublishEventResponse(event.getId(), published)));
    }

    private CanonicalEvent toEvent(PublishEventRequest request) {
        Map<String, Object> payload = new HashMap<>();
        if (request.payload() != null) {
            payload.putAll(request.payload());
        }
        payload.putIfAbsent("action", "custom");
        return CanonicalEvent.builder()
                .id("custom:" + UUID.randomUUID())
                .kind(request.kind())
                .subjectUserId(request.subjectUserId())
                .taskId(request.taskId())
                .priority(request.priority() != null ? request.priority() : EventPriority.MEDIUM)
                .payload(payload)
                .observedAt(Instant.now(clock))
                .build();
    }
}
