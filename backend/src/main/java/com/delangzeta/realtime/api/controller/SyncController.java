package com.delangzeta.realtime.api.controller;

import com.delangzeta.realtime.api.dto.ListenerSetupRequest;
import com.delangzeta.realtime.api.dto.ListenerSetupResponse;
import com.delangzeta.realtime.api.dto.MessageResponse;
import com.delangzeta.realtime.api.dto.SyncRequest;
import com.delangzeta.realtime.api.dto.SyncResponse;
import com.delangzeta.realtime.api.filter.RequestUsers;
import com.delangzeta.realtime.sync.LiveSyncService;
import com.delangzeta.realtime.sync.SyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /sync (pull), POST /listeners/setup and DELETE /listeners (live change listeners).
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class SyncController {

    private final SyncService syncService;
    private final LiveSyncService liveSyncService;

    @PostMapping("/sync")
    public Mono<ResponseEntity<SyncResponse>> sync(@RequestBody(required = false) SyncRequest request,
                                                   ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        SyncRequest body = request != null ? request : new SyncRequest(null, null, null);
        return Mono.fromCallable(() -> syncService.sync(userId, body.collections(),
                        body.lastSyncTimestamp(), body.continuationToken()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> ResponseEntity.ok(SyncResponse.from(result)));
    }

    @PostMapping("/listeners/setup")
    public Mono<ResponseEntity<ListenerSetupResponse>> setupListeners(
            @RequestBody(required = false) ListenerSetupRequest request, ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        return Mono.fromCallable(() -> liveSyncService.subscribe(userId, request == null ? null : request.collections()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(watched -> ResponseEntity.ok(new ListenerSetupResponse("Real-time listeners set up", watched)));
    }

    @DeleteMapping("/listeners")
    public ResponseEntity<MessageResponse> removeListeners(ServerWebExchange exchange) {
        int removed = liveSyncService.unsubscribe(RequestUsers.require(exchange).userId());
        return ResponseEntity.ok(new MessageResponse("Removed " + removed + " listener(s)"));
    }
}
