package com.delangzeta.realtime.sync;

import java.util.Map;

/**
 * One change seen on a watched collection. {@code data} is null for removals.
 */
public record DocumentChange(String collection, String documentId, ChangeType changeType,
                             Map<String, Object> data, String resumeToken) {
}
