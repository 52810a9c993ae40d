package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.notification.gateway.PushGateway;
import com.delangzeta.realtime.notification.gateway.PushResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class NotificationDispatcherTest {

    @Mock
    DeviceTokenService deviceTokenService;
    @Mock
    NotificationHistoryService historyService;

    private ExecutorService executor;
    private NotificationProperties properties;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(8);
        properties = new NotificationProperties();
        lenient().when(deviceTokenService.activeTokens(anyString()))
                .thenAnswer(inv -> List.of("token-" + inv.getArgument(0)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("100 drafts with 10 invalid tokens: 90 delivered, 100 recorded, 10 tokens deactivated")
    void partialBatchFailure() {
        PushGateway gateway = message -> {
            String token = message.tokens().get(0);
            boolean invalid = Integer.parseInt(token.substring("token-user".length())) % 10 == 0;
            return Mono.just(new PushResult(List.of(invalid
                    ? PushResult.TokenResult.failed(token, "NotRegistered")
                    : PushResult.TokenResult.ok(token))));
        };
        NotificationDispatcher dispatcher = new NotificationDispatcher(deviceTokenService, historyService, gateway,
                properties, executor, Clock.systemUTC());
        List<NotificationDraft> drafts = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            drafts.add(draft("user" + i));
        }

        int delivered = dispatcher.sendBulk(drafts);

        assertThat(delivered).isEqualTo(90);
        verify(historyService, times(100)).record(any(), anyBoolean());
        verify(historyService, times(10)).record(any(), eq(false));
        verify(deviceTokenService, times(10)).deactivate(anyString(), any());
        verify(deviceTokenService).deactivate("user10", List.of("token-user10"));
    }

    @Test
    @DisplayName("a failing gateway call counts as undelivered and does not affect the rest of the batch")
    void failuresContainedPerDraft() {
        PushGateway gateway = message -> message.tokens().get(0).equals("token-boom")
                ? Mono.error(new IllegalStateException("gateway down"))
                : Mono.just(new PushResult(List.of(PushResult.TokenResult.ok(message.tokens().get(0)))));
        properties.setBatchSize(2);
        NotificationDispatcher dispatcher = new NotificationDispatcher(deviceTokenService, historyService, gateway,
                properties, executor, Clock.systemUTC());

        int delivered = dispatcher.sendBulk(List.of(draft("a"), draft("boom"), draft("c")));

        assertThat(delivered).isEqualTo(2);
        verify(historyService).record(draft("boom"), false);
    }

    @Test
    @DisplayName("users without devices are recorded as undelivered without calling the gateway")
    void noDevices() {
        PushGateway gateway = message -> {
            throw new AssertionError("gateway must not be called");
        };
        lenient().when(deviceTokenService.activeTokens("lonely")).thenReturn(List.of());
        NotificationDispatcher dispatcher = new NotificationDispatcher(deviceTokenService, historyService, gateway,
                properties, executor, Clock.systemUTC());

        assertThat(dispatcher.send(draft("lonely"))).isFalse();
        verify(historyService).record(draft("lonely"), false);
        verify(deviceTokenService, never()).deactivate(anyString(), any());
    }

    private static NotificationDraft draft(String userId) {
        return new NotificationDraft(userId, "Reward Received!", "You've received 1 ZETA for your contribution",
                Map.of("type", "reward_received"), "reward_received", true, EventPriority.HIGH, "evt-" + userId);
    }
}
