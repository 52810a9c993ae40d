package com.delangzeta.realtime.sync;

import java.time.Instant;
import java.util.Map;

public record SyncedDocument(String id, String collection, Map<String, Object> data, Instant timestamp, String userId) {
}
