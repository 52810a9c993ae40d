package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.notification.NotificationDraft;
import org.springframework.stereotype.Component;

@Component
public class SubmissionReceivedNotificationMapper implements NotificationMapper {

    @Override
    public EventKind kind() {
        return EventKind.SUBMISSION_UPDATE;
    }

    @Override
    public boolean supports(CanonicalEvent event) {
        return "submitted".equals(event.action());
    }

    @Override
    public NotificationDraft draft(CanonicalEvent event, String recipientUserId) {
        return new NotificationDraft(recipientUserId,
                "Submission Received",
                "Your data submission has been received and is being processed",
                Payloads.data("submission_received", "submissionId", event.getSubmissionId()),
                "submission_update",
                false,
                event.getPriority(),
                event.getId());
    }
}
