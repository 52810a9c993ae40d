package com.delangzeta.realtime.sync;

import org.bson.types.ObjectId;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Position of a multi-page pull. {@code sinceMs} and {@code snapshotMs} come from the first page;
 * {@code updates} holds the last delivered (updatedAt, _id) of every collection that still has documents,
 * {@code deletions} the last delivered tombstone, or null once tombstones are exhausted.
 */
public record SyncCursor(
        Long sinceMs,
        long snapshotMs,
        List<String> collections,
        Map<String, Position> updates,
        Position deletions
) {

    public Instant since() {
        return sinceMs == null ? null : Instant.ofEpochMilli(sinceMs);
    }

    public Instant snapshot() {
        return Instant.ofEpochMilli(snapshotMs);
    }

    /**
     * Sort key of the last delivered item. {@code timeMs} is null for documents without updatedAt,
     * which sort first.
     */
    public record Position(Long timeMs, String id, IdType idType) {

        public static Position of(Instant time, Object id) {
            Long ms = time == null ? null : time.toEpochMilli();
            if (id instanceof ObjectId objectId) {
                return new Position(ms, objectId.toHexString(), IdType.OBJECT_ID);
            }
            if (id instanceof Long || id instanceof Integer) {
                return new Position(ms, id.toString(), IdType.LONG);
            }
            return new Position(ms, String.valueOf(id), IdType.STRING);
        }

        public Object idValue() {
            return switch (idType) {
                case OBJECT_ID -> new ObjectId(id);
                case LONG -> Long.parseLong(id);
                case STRING -> id;
            };
        }
    }

    public enum IdType {
        STRING, OBJECT_ID, LONG
    }
}
