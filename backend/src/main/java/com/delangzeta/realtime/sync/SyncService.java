package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.domain.DeletionLogEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Differential pull: documents changed after {@code since} in the collections the caller may read,
 * plus tombstones from the deletion log. Every collection and the tombstone list are capped at the page size.
 * <p>
 * Pages are ordered by (updatedAt, _id). A truncated pull returns a continuation token holding the last
 * (updatedAt, _id) delivered per collection; the next page resumes strictly after it, so documents sharing
 * one updatedAt are never re-read or skipped. The returned timestamp of a truncated pull is 1 ms before the
 * earliest last delivered time, a safe restart point for a client that drops the token. The last page
 * returns the server time taken on the first page.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SyncService {

    public static final List<String> DEFAULT_COLLECTIONS = List.of("tasks", "submissions", "user_profiles");
    private static final String UPDATED_AT = "updatedAt";
    private static final String DELETED_AT = "deletedAt";
    private static final String ID = "_id";

    private final MongoTemplate mongoTemplate;
    private final CollectionAccessPolicy accessPolicy;
    private final SyncProperties properties;
    private final SyncCursorCodec cursorCodec;
    private final Clock clock;

    public SyncResult sync(String userId, List<String> requestedCollections, Instant since) {
        return sync(userId, requestedCollections, since, null);
    }

    /**
     * @param continuationToken token from the previous truncated pull; when present it overrides
     *                          {@code requestedCollections} and {@code since}
     * @throws IllegalArgumentException for a token this service did not issue
     */
    public SyncResult sync(String userId, List<String> requestedCollections, Instant since, String continuationToken) {
        boolean continuation = continuationToken != null && !continuationToken.isBlank();
        SyncCursor cursor = continuation
                ? cursorCodec.decode(continuationToken)
                : new SyncCursor(since == null ? null : since.toEpochMilli(), Instant.now(clock).toEpochMilli(),
                resolve(requestedCollections), Map.of(), null);
        Instant effectiveSince = cursor.since();
        int pageSize = Math.max(1, properties.getPageSize());

        List<SyncedDocument> updates = new ArrayList<>();
        List<String> visible = new ArrayList<>();
        Map<String, SyncCursor.Position> pending = new LinkedHashMap<>();
        Instant truncatedAt = null;
        for (String collection : cursor.collections()) {
            Optional<Criteria> scope = accessPolicy.readScope(userId, collection);
            if (scope.isEmpty()) {
                log.debug("User {} cannot sync {}; omitted", userId, collection);
                continue;
            }
            visible.add(collection);
            Criteria position;
            if (continuation) {
                SyncCursor.Position last = cursor.updates().get(collection);
                if (last == null) {
                    continue;
                }
                position = after(UPDATED_AT, last);
            } else {
                position = effectiveSince == null ? null : Criteria.where(UPDATED_AT).gt(Date.from(effectiveSince));
            }
            Criteria criteria = position == null ? scope.get() : new Criteria().andOperator(scope.get(), position);
            Query query = new Query(criteria)
                    .with(Sort.by(Sort.Order.asc(UPDATED_AT), Sort.Order.asc(ID)))
                    .limit(pageSize + 1);
            List<Document> docs = mongoTemplate.find(query, Document.class, collection);
            if (docs.size() > pageSize) {
                docs = docs.subList(0, pageSize);
                Document lastDoc = docs.get(docs.size() - 1);
                Instant last = updatedAt(lastDoc);
                pending.put(collection, SyncCursor.Position.of(last, lastDoc.get(ID)));
                truncatedAt = earliest(truncatedAt, last == null ? floor(effectiveSince) : last);
            }
            docs.forEach(d -> updates.add(toSynced(collection, d)));
        }

        List<String> deletions = new ArrayList<>();
        SyncCursor.Position deletionsPending = null;
        boolean readDeletions = effectiveSince != null && !visible.isEmpty()
                && (!continuation || cursor.deletions() != null);
        if (readDeletions) {
            Criteria criteria = Criteria.where("userId").is(userId)
                    .and("collection").in(visible)
                    .and(DELETED_AT).gt(Date.from(effectiveSince));
            if (continuation) {
                criteria = new Criteria().andOperator(criteria, after(DELETED_AT, cursor.deletions()));
            }
            Query query = new Query(criteria)
                    .with(Sort.by(Sort.Order.asc(DELETED_AT), Sort.Order.asc(ID)))
                    .limit(pageSize + 1);
            List<DeletionLogEntry> entries = mongoTemplate.find(query, DeletionLogEntry.class);
            if (entries.size() > pageSize) {
                entries = entries.subList(0, pageSize);
                DeletionLogEntry last = entries.get(entries.size() - 1);
                deletionsPending = SyncCursor.Position.of(last.getDeletedAt(), DeletionLogEntry.storedId(last.getId()));
                truncatedAt = earliest(truncatedAt, last.getDeletedAt());
            }
            entries.forEach(e -> deletions.add(e.path()));
        }

        boolean hasMore = !pending.isEmpty() || deletionsPending != null;
        Instant serverTimestamp = hasMore ? truncatedAt.minusMillis(1) : cursor.snapshot();
        if (effectiveSince != null && serverTimestamp.isBefore(effectiveSince)) {
            serverTimestamp = effectiveSince;
        }
        String nextToken = hasMore
                ? cursorCodec.encode(new SyncCursor(cursor.sinceMs(), cursor.snapshotMs(), visible, pending, deletionsPending))
                : null;
        return new SyncResult(updates, deletions, serverTimestamp, hasMore, nextToken);
    }

    private static List<String> resolve(List<String> requestedCollections) {
        return requestedCollections == null || requestedCollections.isEmpty()
                ? DEFAULT_COLLECTIONS
                : new ArrayList<>(new LinkedHashSet<>(requestedCollections));
    }

    /** Strictly after {@code last} in (field, _id) order. */
    private static Criteria after(String field, SyncCursor.Position last) {
        Object id = last.idValue();
        if (last.timeMs() == null) {
            return new Criteria().orOperator(
                    new Criteria().andOperator(Criteria.where(field).is(null), Criteria.where(ID).gt(id)),
                    Criteria.where(field).ne(null));
        }
        Date time = new Date(last.timeMs());
        return new Criteria().orOperator(
                Criteria.where(field).gt(time),
                new Criteria().andOperator(Criteria.where(field).is(time), Criteria.where(ID).gt(id)));
    }

    private static Instant earliest(Instant current, Instant candidate) {
        return current == null || candidate.isBefore(current) ? candidate : current;
    }

    private static Instant floor(Instant since) {
        return since != null ? since : Instant.EPOCH;
    }

    private static SyncedDocument toSynced(String collection, Document doc) {
        Map<String, Object> data = new LinkedHashMap<>(doc);
        Object id = data.remove(ID);
        Object owner = doc.get("userId");
        return new SyncedDocument(String.valueOf(id), collection, data, updatedAt(doc),
                owner == null ? null : owner.toString());
    }

    static Instant updatedAt(Document doc) {
        Object value = doc.get(UPDATED_AT);
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number epochMs) {
            return Instant.ofEpochMilli(epochMs.longValue());
        }
        if (value instanceof String text) {
            return Instant.parse(text);
        }
        return null;
    }
}
