package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.notification.NotificationDraft;
import org.springframework.stereotype.Component;

@Component
public class CrossChainNotificationMapper implements NotificationMapper {

    @Override
    public EventKind kind() {
        return EventKind.BLOCKCHAIN_EVENT;
    }

    @Override
    public boolean supports(CanonicalEvent event) {
        return "crosschain_operation_complete".equals(event.action());
    }

    @Override
    public NotificationDraft draft(CanonicalEvent event, String recipientUserId) {
        boolean success = Payloads.flag(event, "success");
        return new NotificationDraft(recipientUserId,
                success ? "Transaction Completed" : "Transaction Failed",
                success
                        ? "Your cross-chain transaction has been completed successfully"
                        : "Your cross-chain transaction failed. Please try again.",
                Payloads.data("crosschain_update", "operationId", Payloads.text(event, "operationId"),
                        "success", success, "transactionHash", Payloads.text(event, "transactionHash")),
                "blockchain_update",
                false,
                event.getPriority(),
                event.getId());
    }
}
