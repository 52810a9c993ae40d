package com.delangzeta.realtime.ratelimit;

import com.delangzeta.realtime.domain.RateLimitCounter;
import com.delangzeta.realtime.domain.RateLimitScope;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.ReturnDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.bson.conversions.Bson;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

/**
 * Counters in rate_limits, each check one findOneAndUpdate with an aggregation-pipeline update and upsert.
 * The decision is computed by the server from the stored document, so concurrent callers on the same key
 * are serialized by MongoDB's document-level atomicity.
 */
@Slf4j
@RequiredArgsConstructor
public class MongoRateLimitStore implements RateLimitStore {

    private static final int MAX_UPSERT_ATTEMPTS = 3;

    private final MongoTemplate mongoTemplate;

    @Override
    public RateLimitDecision checkAndConsume(RateLimitScope scope, String identifier, int limit, long windowMs, long nowMs) {
        String id = scope.counterId(identifier);
        List<Bson> pipeline = List.of(new Document("$set", nextState(scope, identifier, limit, windowMs, nowMs)));
        FindOneAndUpdateOptions options = new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER);
        for (int attempt = 1; ; attempt++) {
            try {
                Document after = mongoTemplate.execute(RateLimitCounter.COLLECTION,
                        collection -> collection.findOneAndUpdate(Filters.eq("_id", id), pipeline, options));
                return toDecision(after, limit);
            } catch (DuplicateKeyException e) {
                // two first requests raced on the upsert; the loser retries against the inserted document
                if (attempt >= MAX_UPSERT_ATTEMPTS) {
                    throw e;
                }
                log.debug("Upsert race on {}, retrying", id);
            }
        }
    }

    @Override
    public int deleteExpired(long nowMs, int batchSize) {
        Query expired = new Query(Criteria.where("windowEnd").lt(nowMs)).limit(batchSize);
        expired.fields().include("_id");
        List<Object> ids = mongoTemplate.find(expired, Document.class, RateLimitCounter.COLLECTION).stream()
                .map(d -> d.get("_id"))
                .toList();
        if (ids.isEmpty()) {
            return 0;
        }
        return (int) mongoTemplate.remove(new Query(Criteria.where("_id").in(ids)), RateLimitCounter.COLLECTION)
                .getDeletedCount();
    }

    /**
     * $set stage. A missing windowEnd compares below any number, so a fresh upsert takes the reset branch.
     */
    static Document nextState(RateLimitScope scope, String identifier, int limit, long windowMs, long nowMs) {
        Document windowOver = new Document("$lte", List.of("$windowEnd", nowMs));
        Document underLimit = new Document("$lt", List.of("$count", limit));
        return new Document()
                .append("scope", scope.name())
                .append("identifier", identifier)
                .append("count", cond(windowOver, 1,
                        cond(underLimit, new Document("$add", List.of("$count", 1)), "$count")))
                .append("windowStart", cond(windowOver, nowMs, "$windowStart"))
                .append("windowEnd", cond(windowOver, nowMs + windowMs, "$windowEnd"))
                .append("allowed", new Document("$or", List.of(windowOver, underLimit)))
                .append("lastRequest", nowMs);
    }

    private static Document cond(Object condition, Object then, Object otherwise) {
        return new Document("$cond", List.of(condition, then, otherwise));
    }

    private static RateLimitDecision toDecision(Document after, int limit) {
        if (after == null) {
            throw new IllegalStateException("findOneAndUpdate with upsert returned no document");
        }
        long windowEnd = ((Number) after.get("windowEnd")).longValue();
        if (!after.getBoolean("allowed", false)) {
            return RateLimitDecision.rejected(limit, windowEnd);
        }
        int count = ((Number) after.get("count")).intValue();
        return RateLimitDecision.allowed(limit, Math.max(0, limit - count), windowEnd);
    }
}
