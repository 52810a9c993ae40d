package com.delangzeta.realtime.api.dto;

public record MessageResponse(String message) {
}
