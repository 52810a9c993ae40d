package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.config.AsyncConfig;
import com.delangzeta.realtime.notification.gateway.PushGateway;
import com.delangzeta.realtime.notification.gateway.PushMessage;
import com.delangzeta.realtime.notification.gateway.PushResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Sends drafts to the push gateway. Bulk sends run batch by batch, drafts within a batch concurrently on
 * the notification executor; one failing draft never affects the others.
 */
@Slf4j
@Service
public class NotificationDispatcher {

    private final DeviceTokenService deviceTokenService;
    private final NotificationHistoryService historyService;
    private final PushGateway pushGateway;
    private final NotificationProperties properties;
    private final Executor notificationExecutor;
    private final Clock clock;

    public NotificationDispatcher(DeviceTokenService deviceTokenService,
                                  NotificationHistoryService historyService,
                                  PushGateway pushGateway,
                                  NotificationProperties properties,
                                  @Qualifier(AsyncConfig.NOTIFICATION_EXECUTOR) Executor notificationExecutor,
                                  Clock clock) {
        this.deviceTokenService = deviceTokenService;
        this.historyService = historyService;
        this.pushGateway = pushGateway;
        this.properties = properties;
        this.notificationExecutor = notificationExecutor;
        this.clock = clock;
    }

    /**
     * @return number of drafts delivered to at least one device
     */
    public int sendBulk(List<NotificationDraft> drafts) {
        int batchSize = Math.max(1, properties.getBatchSize());
        int delivered = 0;
        for (int from = 0; from < drafts.size(); from += batchSize) {
            List<NotificationDraft> batch = drafts.subList(from, Math.min(drafts.size(), from + batchSize));
            List<CompletableFuture<Boolean>> futures = batch.stream()
                    .map(d -> CompletableFuture.supplyAsync(() -> send(d), notificationExecutor)
                            .exceptionally(e -> {
                                log.warn("Notification for {} failed", d.userId(), e);
                                return false;
                            }))
                    .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
            delivered += (int) futures.stream().map(CompletableFuture::join).filter(Boolean::booleanValue).count();
        }
        log.info("Sent {}/{} notifications", delivered, drafts.size());
        return delivered;
    }

    /**
     * Sends one draft to every active device of its user and records it in the history.
     *
     * @return true when at least one device accepted it
     */
    public boolean send(NotificationDraft draft) {
        List<String> tokens = deviceTokenService.activeTokens(draft.userId());
        boolean delivered = false;
        if (tokens.isEmpty()) {
            log.debug("No device tokens for {}", draft.userId());
        } else {
            try {
                PushResult result = pushGateway.send(toMessage(draft, tokens))
                        .block(Duration.ofMillis(properties.getSendTimeoutMs()));
                if (result != null) {
                    delivered = result.anySucceeded();
                    List<String> unregistered = result.unregisteredTokens();
                    if (!unregistered.isEmpty()) {
                        deviceTokenService.deactivate(draft.userId(), unregistered);
                    }
                }
            } catch (RuntimeException e) {
                log.warn("Push to {} failed: {}", draft.userId(), e.toString());
            }
        }
        try {
            historyService.record(draft, delivered);
        } catch (RuntimeException e) {
            log.warn("Could not store notification for {}", draft.userId(), e);
        }
        return delivered;
    }

    private PushMessage toMessage(NotificationDraft draft, List<String> tokens) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (draft.data() != null) {
            data.putAll(draft.data());
        }
        data.put("userId", draft.userId());
        data.put("timestamp", Instant.now(clock).toString());
        String tag = draft.tag() != null ? draft.tag() : properties.getDefaultTag();
        return new PushMessage(tokens, draft.title(), draft.body(), properties.getDefaultIcon(),
                properties.getDefaultBadge(), tag, draft.requireInteraction(), data);
    }
}
