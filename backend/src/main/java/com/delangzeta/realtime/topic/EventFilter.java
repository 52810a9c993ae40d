package com.delangzeta.realtime.topic;

import com.delangzeta.realtime.domain.EventKind;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

@FunctionalInterface
public interface EventFilter {

    boolean matches(EventAttributes attributes);

    default EventFilter and(EventFilter other) {
        return a -> matches(a) && other.matches(a);
    }

    static EventFilter all() {
        return a -> true;
    }

    /** Events addressed to the given user. */
    static EventFilter forUser(String userId) {
        Objects.requireNonNull(userId, "userId");
        return a -> userId.equals(a.subjectUserId());
    }

    static EventFilter ofKinds(EventKind first, EventKind... rest) {
        Set<EventKind> kinds = EnumSet.of(first, rest);
        return a -> a.kind() != null && kinds.contains(a.kind());
    }
}
