package com.delangzeta.realtime.notification.gateway;

import java.util.List;
import java.util.Map;

/**
 * One notification addressed to all active devices of one user.
 */
public record PushMessage(
        List<String> tokens,
        String title,
        String body,
        String icon,
        String badge,
        String tag,
        boolean requireInteraction,
        Map<String, Object> data
) {
}
