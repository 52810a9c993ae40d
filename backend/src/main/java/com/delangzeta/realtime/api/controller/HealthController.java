package com.delangzeta.realtime.api.controller;

import com.delangzeta.realtime.api.dto.HealthResponse;
import com.delangzeta.realtime.ingestion.connector.ChainConnectorRegistry;
import com.delangzeta.realtime.sync.LiveSyncService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

/**
 * GET /health. Public and not rate limited.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final LiveSyncService liveSyncService;
    private final ChainConnectorRegistry connectorRegistry;
    private final Clock clock;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("healthy", Instant.now(clock),
                liveSyncService.activeListenerCount(), connectorRegistry.status()));
    }
}
