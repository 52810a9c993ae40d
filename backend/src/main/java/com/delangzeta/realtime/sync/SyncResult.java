package com.delangzeta.realtime.sync;

import java.time.Instant;
import java.util.List;

/**
 * {@code serverTimestamp} is what the client sends back as {@code since} once {@code hasMore} is false.
 * While {@code hasMore} is true the client sends {@code continuationToken} instead.
 */
public record SyncResult(
        List<SyncedDocument> updates,
        List<String> deletions,
        Instant serverTimestamp,
        boolean hasMore,
        String continuationToken
) {
}
