package com.delangzeta.realtime.sync;

import com.mongodb.client.model.changestream.ChangeStreamDocument;
import com.mongodb.client.model.changestream.FullDocument;
import com.mongodb.client.model.changestream.OperationType;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.bson.BsonDocument;
import org.bson.BsonValue;
import org.bson.Document;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.messaging.ChangeStreamRequest;
import org.springframework.data.mongodb.core.messaging.DefaultMessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Message;
import org.springframework.data.mongodb.core.messaging.MessageListener;
import org.springframework.data.mongodb.core.messaging.MessageListenerContainer;
import org.springframework.data.mongodb.core.messaging.Subscription;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Change streams through Spring Data's message listener container. Needs a replica set.
 */
@Slf4j
@Component
public class MongoCollectionChangeFeed implements CollectionChangeFeed {

    private final MessageListenerContainer container;

    public MongoCollectionChangeFeed(MongoTemplate mongoTemplate) {
        this.container = new DefaultMessageListenerContainer(mongoTemplate);
    }

    @Override
    public ChangeSubscription watch(String collection, String ownerUserId, Consumer<DocumentChange> listener) {
        if (!container.isRunning()) {
            container.start();
        }
        Criteria criteria = Criteria.where("operationType").in("insert", "update", "replace");
        if (ownerUserId != null) {
            criteria = criteria.and("fullDocument.userId").is(ownerUserId);
        }
        MessageListener<ChangeStreamDocument<Document>, Document> messageListener =
                message -> deliver(collection, message, listener);
        ChangeStreamRequest<Document> request = ChangeStreamRequest.builder(messageListener)
                .collection(collection)
                .filter(Aggregation.newAggregation(Aggregation.match(criteria)))
                .fullDocumentLookup(FullDocument.UPDATE_LOOKUP)
                .build();
        Subscription subscription = container.register(request, Document.class);
        log.debug("Watching {} for {}", collection, ownerUserId == null ? "all users" : ownerUserId);
        return () -> container.remove(subscription);
    }

    @PreDestroy
    public void shutdown() {
        container.stop();
    }

    private static void deliver(String collection, Message<ChangeStreamDocument<Document>, Document> message,
                                Consumer<DocumentChange> listener) {
        ChangeStreamDocument<Document> raw = message.getRaw();
        if (raw == null) {
            return;
        }
        ChangeType type = raw.getOperationType() == OperationType.INSERT ? ChangeType.ADDED : ChangeType.MODIFIED;
        Document body = message.getBody();
        Map<String, Object> data = body == null ? null : new LinkedHashMap<>(body);
        if (data != null) {
            data.remove("_id");
        }
        BsonDocument resumeToken = raw.getResumeToken();
        try {
            listener.accept(new DocumentChange(collection, documentId(raw.getDocumentKey()), type, data,
                    resumeToken == null ? null : resumeToken.toJson()));
        } catch (RuntimeException e) {
            log.warn("Change listener on {} failed", collection, e);
        }
    }

    private static String documentId(BsonDocument key) {
        if (key == null) {
            return null;
        }
        BsonValue id = key.get("_id");
        if (id == null) {
            return null;
        }
        if (id.isObjectId()) {
            return id.asObjectId().getValue().toHexString();
        }
        if (id.isString()) {
            return id.asString().getValue();
        }
        return id.toString();
    }
}
