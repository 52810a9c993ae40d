package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.notification.NotificationDraft;
import org.springframework.stereotype.Component;

@Component
public class RewardNotificationMapper implements NotificationMapper {

    @Override
    public EventKind kind() {
        return EventKind.REWARD_DISTRIBUTED;
    }

    /** Only on-chain distributions; document changes in user_rewards share the kind but not the action. */
    @Override
    public boolean supports(CanonicalEvent event) {
        return "reward_distributed".equals(event.action());
    }

    @Override
    public NotificationDraft draft(CanonicalEvent event, String recipientUserId) {
        String amount = Payloads.text(event, "amount");
        String token = Payloads.text(event, "token");
        return new NotificationDraft(recipientUserId,
                "Reward Received!",
                "You've received " + amount + " " + token + " for your contribution",
                Payloads.data("reward_received", "amount", amount, "token", token,
                        "transactionHash", Payloads.text(event, "transactionHash")),
                "reward_received",
                true,
                event.getPriority(),
                event.getId());
    }
}
