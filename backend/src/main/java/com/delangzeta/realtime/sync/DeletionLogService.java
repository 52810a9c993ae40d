package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.domain.DeletionLogEntry;
import com.delangzeta.realtime.topic.EventTopic;
import com.mongodb.client.result.DeleteResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;

/**
 * Deletes a document and records the tombstone in one transaction, then announces the removal.
 * Change streams only carry inserts and updates, so this is the only path that tells clients about deletes.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DeletionLogService {

    private final MongoTemplate mongoTemplate;
    private final TransactionTemplate mongoTransactionTemplate;
    private final EventTopic eventTopic;
    private final Clock clock;

    /**
     * @return false when no such document existed (nothing logged or published)
     */
    public boolean delete(String collection, String documentId, String userId) {
        Instant deletedAt = Instant.now(clock);
        Boolean removed = mongoTransactionTemplate.execute(status -> {
            DeleteResult result = mongoTemplate.remove(new Query(Criteria.where("_id").is(documentId)), collection);
            if (result.getDeletedCount() == 0) {
                return false;
            }
            DeletionLogEntry entry = new DeletionLogEntry();
            entry.setCollection(collection);
            entry.setDocumentId(documentId);
            entry.setUserId(userId);
            entry.setDeletedAt(deletedAt);
            mongoTemplate.insert(entry);
            return true;
        });
        if (!Boolean.TRUE.equals(removed)) {
            return false;
        }
        try {
            eventTopic.publish(CollectionEvents.deletionEvent(userId, collection, documentId, deletedAt));
        } catch (RuntimeException e) {
            // the tombstone is committed; differential sync still reports the deletion
            log.warn("Could not publish deletion of {}/{}", collection, documentId, e);
        }
        return true;
    }
}
