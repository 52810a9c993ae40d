package com.delangzeta.realtime.api.controller;

import com.delangzeta.realtime.api.dto.BlockchainEventsResponse;
import com.delangzeta.realtime.ingestion.store.CanonicalEventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Chain-originated event history, newest block first. Authentication optional.
 */
@RestController
@RequestMapping("/api/v1/blockchain")
@RequiredArgsConstructor
public class BlockchainEventController {

    static final int DEFAULT_LIMIT = 100;

    private final CanonicalEventStore eventStore;

    @GetMapping("/events")
    public Mono<ResponseEntity<BlockchainEventsResponse>> events(
            @RequestParam(required = false) String eventType,
            @RequestParam(required = false) Long fromBlock,
            @RequestParam(required = false) Long toBlock,
            @RequestParam(required = false) Integer limit
    ) {
        int effective = limit != null ? limit : DEFAULT_LIMIT;
        return Mono.fromCallable(() -> eventStore.history(eventType, fromBlock, toBlock, effective))
                .subscribeOn(Schedulers.boundedElastic())
                .map(events -> ResponseEntity.ok(new BlockchainEventsResponse(events, events.size())));
    }
}
