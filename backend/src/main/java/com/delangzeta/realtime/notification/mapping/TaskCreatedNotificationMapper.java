package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.notification.NotificationDraft;
import org.springframework.stereotype.Component;

@Component
public class TaskCreatedNotificationMapper implements NotificationMapper {

    @Override
    public EventKind kind() {
        return EventKind.TASK_UPDATE;
    }

    @Override
    public boolean supports(CanonicalEvent event) {
        return "created".equals(event.action());
    }

    @Override
    public boolean broadcast() {
        return true;
    }

    @Override
    public NotificationDraft draft(CanonicalEvent event, String recipientUserId) {
        String reward = Payloads.text(event, "reward");
        return new NotificationDraft(recipientUserId,
                "New Task Available",
                "A new language data task has been created with " + reward + " reward",
                Payloads.data("task_created", "taskId", event.getTaskId(), "reward", reward),
                "task_created",
                false,
                event.getPriority(),
                event.getId());
    }
}
