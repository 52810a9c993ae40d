package com.delangzeta.realtime.domain;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.bson.types.ObjectId;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Tombstone read by differential sync. Written in the same transaction as the delete it records.
 */
@Document(collection = DeletionLogEntry.COLLECTION)
@CompoundIndex(name = "user_deletedAt_id", def = "{'userId': 1, 'deletedAt': 1, '_id': 1}")
@NoArgsConstructor
@Getter
@Setter
public class DeletionLogEntry {

    public static final String COLLECTION = "_deletions";

    @Id
    private String id;
    private String collection;
    private String documentId;
    private String userId;
    private Instant deletedAt;

    /** The _id as stored: generated ids are ObjectIds even though the property is a String. */
    public static Object storedId(String id) {
        return id != null && ObjectId.isValid(id) ? new ObjectId(id) : id;
    }

    /** {@code <collection>/<documentId>} as returned to sync clients. */
    public String path() {
        return collection + "/" + documentId;
    }
}
