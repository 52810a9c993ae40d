package com.delangzeta.realtime.api.dto;

import com.delangzeta.realtime.ingestion.connector.ConnectorStatus;

import java.time.Instant;
import java.util.List;

public record HealthResponse(String status, Instant timestamp, int activeListeners, List<ConnectorStatus> connectors) {
}
