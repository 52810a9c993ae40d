package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.EventPriority;

import java.util.Map;

/**
 * A notification for one user, not yet sent. {@code eventId} is null for ad-hoc sends.
 */
public record NotificationDraft(
        String userId,
        String title,
        String body,
        Map<String, Object> data,
        String tag,
        boolean requireInteraction,
        EventPriority priority,
        String eventId
) {
}
