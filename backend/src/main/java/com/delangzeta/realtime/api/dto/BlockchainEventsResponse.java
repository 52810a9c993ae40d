package com.delangzeta.realtime.api.dto;

import com.delangzeta.realtime.domain.CanonicalEvent;

import java.util.List;

public record BlockchainEventsResponse(List<CanonicalEvent> events, int count) {
}
