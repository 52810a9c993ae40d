package com.delangzeta.realtime.domain;

/**
 * Delivery priority. HIGH skips the notification batching delay.
 */
public enum EventPriority {
    LOW,
    MEDIUM,
    HIGH
}
