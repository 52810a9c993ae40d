package com.delangzeta.realtime.api.dto;

import com.delangzeta.realtime.domain.UserNotification;

import java.util.List;

public record NotificationHistoryResponse(List<UserNotification> notifications, int limit, int offset) {
}
