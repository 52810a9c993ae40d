package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.common.IdempotencyKeys;
import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds canonical events for document changes. Kind and priority come from the collection name.
 */
final class CollectionEvents {

    private CollectionEvents() {
    }

    static EventKind kindOf(String collection) {
        return switch (collection) {
            case "submissions", "user_submissions" -> EventKind.SUBMISSION_UPDATE;
            case "validations", "user_validations" -> EventKind.VALIDATION_UPDATE;
            case "rewards", "user_rewards" -> EventKind.REWARD_DISTRIBUTED;
            default -> EventKind.TASK_UPDATE;
        };
    }

    static EventPriority priorityOf(String collection) {
        if (collection.contains("reward")) {
            return EventPriority.HIGH;
        }
        if (collection.contains("validation")) {
            return EventPriority.MEDIUM;
        }
        return EventPriority.LOW;
    }

    static CanonicalEvent changeEvent(String userId, DocumentChange change, Instant observedAt) {
        String id = IdempotencyKeys.contentHash("change", userId, change.collection(), change.documentId(),
                change.changeType().wireName(), change.resumeToken());
        return build(id, userId, change, observedAt);
    }

    static CanonicalEvent deletionEvent(String userId, String collection, String documentId, Instant deletedAt) {
        DocumentChange change = new DocumentChange(collection, documentId, ChangeType.REMOVED, null, null);
        String id = IdempotencyKeys.contentHash("deletion", collection, documentId, deletedAt.toString());
        return build(id, userId, change, deletedAt);
    }

    private static CanonicalEvent build(String id, String userId, DocumentChange change, Instant observedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", change.changeType().wireName());
        payload.put("changeType", change.changeType().wireName());
        payload.put("documentId", change.documentId());
        payload.put("collection", change.collection());
        payload.put("data", change.data());
        Object taskId = change.data() == null ? null : change.data().get("taskId");
        if (taskId == null && "tasks".equals(change.collection())) {
            taskId = change.documentId();
        }
        return CanonicalEvent.builder()
                .id(id)
                .kind(kindOf(change.collection()))
                .subjectUserId(userId)
                .taskId(taskId == null ? null : taskId.toString())
                .payload(payload)
                .priority(priorityOf(change.collection()))
                .observedAt(observedAt)
                .build();
    }
}
