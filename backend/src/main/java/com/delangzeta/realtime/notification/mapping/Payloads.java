package com.delangzeta.realtime.notification.mapping;

import com.delangzeta.realtime.domain.CanonicalEvent;

import java.util.LinkedHashMap;
import java.util.Map;

final class Payloads {

    private Payloads() {
    }

    static String text(CanonicalEvent event, String key) {
        Object value = event.getPayload() == null ? null : event.getPayload().get(key);
        return value == null ? null : value.toString();
    }

    static boolean flag(CanonicalEvent event, String key) {
        Object value = event.getPayload() == null ? null : event.getPayload().get(key);
        return value instanceof Boolean b ? b : Boolean.parseBoolean(String.valueOf(value));
    }

    /** Notification data map; null values are dropped. */
    static Map<String, Object> data(String type, Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type);
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                data.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
        }
        return data;
    }
}
