package com.delangzeta.realtime.api.dto;

import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/**
 * POST /api/v1/events/publish body. A missing priority means MEDIUM; "action" defaults to "custom".
 */
public record PublishEventRequest(
        @NotNull(message = "VALIDATION_ERROR") EventKind kind,
        String subjectUserId,
        String taskId,
        EventPriority priority,
        Map<String, Object> payload
) {
}
