package com.delangzeta.realtime.api.dto;

/**
 * Optional title/body for a test push; defaults are used when absent.
 */
public record TestNotificationRequest(String title, String body) {
}
