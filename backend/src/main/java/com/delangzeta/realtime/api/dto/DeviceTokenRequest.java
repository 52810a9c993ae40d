package com.delangzeta.realtime.api.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.Map;

public record DeviceTokenRequest(@NotBlank(message = "TOKEN_REQUIRED") String token, Map<String, Object> deviceInfo) {
}
