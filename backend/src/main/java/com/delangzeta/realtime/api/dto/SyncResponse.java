package com.delangzeta.realtime.api.dto;

import com.delangzeta.realtime.sync.SyncResult;
import com.delangzeta.realtime.sync.SyncedDocument;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

public record SyncResponse(
        List<SyncedDocument> updates,
        List<String> deletions,
        Instant timestamp,
        boolean hasMore,
        @JsonInclude(JsonInclude.Include.NON_NULL) String continuationToken
) {

    public static SyncResponse from(SyncResult result) {
        return new SyncResponse(result.updates(), result.deletions(), result.serverTimestamp(), result.hasMore(),
                result.continuationToken());
    }
}
