package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.EventKind;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class NotificationMapperRegistry {

    private final Map<EventKind, NotificationMapper> byKind = new EnumMap<>(EventKind.class);

    public NotificationMapperRegistry(List<NotificationMapper> mappers) {
        for (NotificationMapper mapper : mappers) {
            NotificationMapper previous = byKind.put(mapper.kind(), mapper);
            if (previous != null) {
                throw new IllegalStateException("Two notification mappers for " + mapper.kind());
            }
        }
    }

    public Optional<NotificationMapper> forKind(EventKind kind) {
        return Optional.ofNullable(byKind.get(kind));
    }
}
