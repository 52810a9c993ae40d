package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.NotificationPreference;

import java.util.function.Predicate;

/**
 * Preference switch that gates each event kind. Push being off gates everything.
 */
public enum NotificationCategory {
    TASK_UPDATES(NotificationPreference::isTaskUpdates),
    VALIDATION_UPDATES(NotificationPreference::isValidationUpdates),
    REWARD_NOTIFICATIONS(NotificationPreference::isRewardNotifications);

    private final Predicate<NotificationPreference> flag;

    NotificationCategory(Predicate<NotificationPreference> flag) {
        this.flag = flag;
    }

    public boolean isEnabled(NotificationPreference preference) {
        return preference.isEnablePushNotifications() && flag.test(preference);
    }

    public static NotificationCategory of(EventKind kind) {
        return switch (kind) {
            case TASK_UPDATE, SUBMISSION_UPDATE -> TASK_UPDATES;
            case VALIDATION_UPDATE -> VALIDATION_UPDATES;
            case REWARD_DISTRIBUTED, BLOCKCHAIN_EVENT -> REWARD_NOTIFICATIONS;
        };
    }
}
