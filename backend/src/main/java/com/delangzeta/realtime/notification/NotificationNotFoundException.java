package com.delangzeta.realtime.notification;

public class NotificationNotFoundException extends RuntimeException {

    public NotificationNotFoundException(String notificationId) {
        super("Notification not found: " + notificationId);
    }
}
