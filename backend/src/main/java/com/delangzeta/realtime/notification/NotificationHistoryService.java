package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.UserNotification;
import com.delangzeta.realtime.domain.UserNotificationRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
@RequiredArgsConstructor
public class NotificationHistoryService {

    public static final int MAX_LIMIT = 100;

    private final UserNotificationRepository repository;
    private final Clock clock;

    public UserNotification record(NotificationDraft draft, boolean delivered) {
        UserNotification n = new UserNotification();
        n.setUserId(draft.userId());
        n.setTitle(draft.title());
        n.setBody(draft.body());
        n.setData(draft.data());
        n.setTag(draft.tag());
        n.setRequireInteraction(draft.requireInteraction());
        n.setEventId(draft.eventId());
        n.setSentAt(Instant.now(clock));
        n.setDelivered(delivered);
        n.setRead(false);
        return repository.save(n);
    }

    /** Newest first; limit is clamped to [1, 100] and offset to 0 or more. */
    public List<UserNotification> history(String userId, int limit, int offset) {
        return repository.findHistory(userId, Math.max(1, Math.min(limit, MAX_LIMIT)), Math.max(0, offset));
    }

    /**
     * @throws NotificationNotFoundException when the id does not exist or belongs to someone else
     */
    public UserNotification markRead(String userId, String notificationId) {
        UserNotification n = repository.findByIdAndUserId(notificationId, userId)
                .orElseThrow(() -> new NotificationNotFoundException(notificationId));
        if (!n.isRead()) {
            n.setRead(true);
            n.setReadAt(Instant.now(clock));
            n = repository.save(n);
        }
        return n;
    }
}
