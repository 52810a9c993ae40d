package com.delangzeta.realtime.api.controller;

import com.delangzeta.realtime.api.dto.DeviceTokenRequest;
import com.delangzeta.realtime.api.dto.MessageResponse;
import com.delangzeta.realtime.api.dto.NotificationHistoryResponse;
import com.delangzeta.realtime.api.dto.TestNotificationRequest;
import com.delangzeta.realtime.api.dto.TestNotificationResponse;
import com.delangzeta.realtime.api.filter.RequestUsers;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.domain.NotificationPreference;
import com.delangzeta.realtime.domain.UserNotification;
import com.delangzeta.realtime.notification.DeviceTokenService;
import com.delangzeta.realtime.notification.NotificationDraft;
import com.delangzeta.realtime.notification.NotificationFanOut;
import com.delangzeta.realtime.notification.NotificationHistoryService;
import com.delangzeta.realtime.notification.NotificationPreferenceService;
import com.delangzeta.realtime.notification.PreferenceUpdate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Preferences, device tokens, history and test sends for the calling user.
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
public class NotificationController {

    private final NotificationPreferenceService preferenceService;
    private final DeviceTokenService deviceTokenService;
    private final NotificationHistoryService historyService;
    private final NotificationFanOut fanOut;

    @GetMapping("/preferences")
    public Mono<ResponseEntity<NotificationPreference>> preferences(ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        return blocking(() -> ResponseEntity.ok(preferenceService.get(userId)));
    }

    @PutMapping("/preferences")
    public Mono<ResponseEntity<NotificationPreference>> updatePreferences(@RequestBody PreferenceUpdate update,
                                                                          ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        return blocking(() -> ResponseEntity.ok(preferenceService.update(userId, update)));
    }

    @PostMapping("/device-token")
    public Mono<ResponseEntity<MessageResponse>> registerToken(@Valid @RequestBody DeviceTokenRequest request,
                                                               ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        return blocking(() -> {
            deviceTokenService.register(userId, request.token().trim(), request.deviceInfo());
            return ResponseEntity.ok(new MessageResponse("Device token registered"));
        });
    }

    @DeleteMapping("/device-token")
    public Mono<ResponseEntity<MessageResponse>> unregisterToken(@Valid @RequestBody DeviceTokenRequest request,
                                                                 ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        return blocking(() -> deviceTokenService.unregister(userId, request.token().trim())
                ? ResponseEntity.ok(new MessageResponse("Device token unregistered"))
                : ResponseEntity.ok(new MessageResponse("Device token not found")));
    }

    @GetMapping("/history")
    public Mono<ResponseEntity<NotificationHistoryResponse>> history(
            @RequestParam(required = false, defaultValue = "50") int limit,
            @RequestParam(required = false, defaultValue = "0") int offset,
            ServerWebExchange exchange
    ) {
        String userId = RequestUsers.require(exchange).userId();
        int clampedLimit = Math.max(1, Math.min(limit, NotificationHistoryService.MAX_LIMIT));
        int clampedOffset = Math.max(0, offset);
        return blocking(() -> ResponseEntity.ok(new NotificationHistoryResponse(
                historyService.history(userId, clampedLimit, clampedOffset), clampedLimit, clampedOffset)));
    }

    @PutMapping("/{id}/read")
    public Mono<ResponseEntity<UserNotification>> markRead(@PathVariable String id, ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        return blocking(() -> ResponseEntity.ok(historyService.markRead(userId, id)));
    }

    @PostMapping("/test")
    public Mono<ResponseEntity<TestNotificationResponse>> test(@RequestBody(required = false) TestNotificationRequest request,
                                                               ServerWebExchange exchange) {
        String userId = RequestUsers.require(exchange).userId();
        String title = request != null && request.title() != null ? request.title() : "Test Notification";
        String body = request != null && request.body() != null
                ? request.body() : "This is a test notification from DeLangZeta";
        NotificationDraft draft = new NotificationDraft(userId, title, body, Map.of("type", "test"),
                "test", false, EventPriority.HIGH, null);
        return blocking(() -> ResponseEntity.ok(new TestNotificationResponse(fanOut.sendDirect(draft))));
    }

    private static <T> Mono<T> blocking(Callable<T> call) {
        return Mono.fromCallable(call).subscribeOn(Schedulers.boundedElastic());
    }
}
