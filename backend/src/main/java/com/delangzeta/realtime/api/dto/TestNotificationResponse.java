package com.delangzeta.realtime.api.dto;

public record TestNotificationResponse(boolean delivered) {
}
