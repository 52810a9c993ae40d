package com.delangzeta.realtime.api.dto;

public record PublishEventResponse(String eventId, boolean published) {
}
