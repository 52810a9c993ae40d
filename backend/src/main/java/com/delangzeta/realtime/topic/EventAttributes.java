package com.delangzeta.realtime.topic;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing attributes carried next to the payload, so subscribers can filter without deserializing it.
 */
public record EventAttributes(
        String eventId,
        EventKind kind,
        String subjectUserId,
        EventPriority priority,
        String taskId,
        Instant observedAt
) {

    public static final String EVENT_ID = "eventId";
    public static final String KIND = "kind";
    public static final String SUBJECT_USER_ID = "subjectUserId";
    public static final String PRIORITY = "priority";
    public static final String TASK_ID = "taskId";
    public static final String OBSERVED_AT = "observedAt";

    public static EventAttributes of(CanonicalEvent event) {
        return new EventAttributes(event.getId(), event.getKind(), event.getSubjectUserId(), event.getPriority(),
                event.getTaskId(), event.getObservedAt());
    }

    /** Non-null attributes as strings; kind uses its wire name. */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        put(map, EVENT_ID, eventId);
        put(map, KIND, kind == null ? null : kind.wireName());
        put(map, SUBJECT_USER_ID, subjectUserId);
        put(map, PRIORITY, priority == null ? null : priority.name());
        put(map, TASK_ID, taskId);
        put(map, OBSERVED_AT, observedAt == null ? null : observedAt.toString());
        return map;
    }

    public static EventAttributes fromMap(Map<String, String> map) {
        String kind = map.get(KIND);
        String priority = map.get(PRIORITY);
        String observedAt = map.get(OBSERVED_AT);
        return new EventAttributes(
                map.get(EVENT_ID),
                kind == null ? null : EventKind.fromWireName(kind),
                map.get(SUBJECT_USER_ID),
                priority == null ? null : EventPriority.valueOf(priority),
                map.get(TASK_ID),
                observedAt == null ? null : Instant.parse(observedAt));
    }

    private static void put(Map<String, String> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }
}
