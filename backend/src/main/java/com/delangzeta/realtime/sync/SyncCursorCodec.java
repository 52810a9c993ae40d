package com.delangzeta.realtime.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Base64;

/**
 * Opaque continuation tokens: URL-safe Base64 of the cursor JSON.
 */
@Component
@RequiredArgsConstructor
public class SyncCursorCodec {

    private final ObjectMapper objectMapper;

    public String encode(SyncCursor cursor) {
        try {
            return Base64.getUrlEncoder().withoutPadding().encodeToString(objectMapper.writeValueAsBytes(cursor));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode sync cursor", e);
        }
    }

    /**
     * @throws IllegalArgumentException for a token this service did not issue
     */
    public SyncCursor decode(String token) {
        try {
            SyncCursor cursor = objectMapper.readValue(Base64.getUrlDecoder().decode(token), SyncCursor.class);
            if (cursor.collections() == null || cursor.updates() == null) {
                throw new IllegalArgumentException("Invalid continuation token");
            }
            return cursor;
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid continuation token", e);
        }
    }
}
