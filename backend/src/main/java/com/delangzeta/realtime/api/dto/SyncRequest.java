package com.delangzeta.realtime.api.dto;

import java.time.Instant;
import java.util.List;

/**
 * POST /api/v1/sync request body. All fields optional; {@code continuationToken} resumes a pull that
 * returned {@code hasMore=true}.
 */
public record SyncRequest(List<String> collections, Instant lastSyncTimestamp, String continuationToken) {
}
