package com.delangzeta.realtime.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Notification history entry, stored for every dispatched draft whatever the push outcome.
 */
@Document(collection = "user_notifications")
@CompoundIndex(name = "user_sentAt", def = "{'userId': 1, 'sentAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class UserNotification {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String title;
    private String body;
    private Map<String, Object> data;
    private String tag;
    private boolean requireInteraction;
    private String eventId;
    private Instant sentAt;
    private boolean delivered;
    private boolean read;
    private Instant readAt;
}
