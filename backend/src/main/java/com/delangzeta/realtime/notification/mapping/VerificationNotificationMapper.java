package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.notification.NotificationDraft;
import org.springframework.stereotype.Component;

@Component
public class VerificationNotificationMapper implements NotificationMapper {

    @Override
    public EventKind kind() {
        return EventKind.VALIDATION_UPDATE;
    }

    @Override
    public boolean supports(CanonicalEvent event) {
        return "verification_complete".equals(event.action());
    }

    @Override
    public NotificationDraft draft(CanonicalEvent event, String recipientUserId) {
        boolean approved = Payloads.flag(event, "approved");
        String score = Payloads.text(event, "finalScore");
        return new NotificationDraft(recipientUserId,
                approved ? "Submission Approved!" : "Submission Needs Revision",
                "Your submission scored " + score + "/100 and " + (approved ? "has been approved" : "needs revision"),
                Payloads.data("verification_complete",
                        "submissionId", event.getSubmissionId(), "approved", approved, "score", score),
                "validation_update",
                true,
                event.getPriority(),
                event.getId());
    }
}
