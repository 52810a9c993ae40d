package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.notification.NotificationDraft;

/**
 * Pure mapping from one event kind to the notification a recipient receives. Preferences are applied by
 * the caller before {@link #draft} is invoked.
 */
public interface NotificationMapper {

    EventKind kind();

    /** Whether this event produces a notification at all (usually a check on the payload action). */
    boolean supports(CanonicalEvent event);

    /** Events without a subject go to the broadcast audience when this returns true. */
    default boolean broadcast() {
        return false;
    }

    NotificationDraft draft(CanonicalEvent event, String recipientUserId);
}
