package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.PrivacyLevel;

/**
 * Partial preference update; null fields keep their stored value.
 */
public record PreferenceUpdate(
        Boolean enablePushNotifications,
        Boolean enableEmailNotifications,
        Boolean enableInAppNotifications,
        Boolean taskUpdates,
        Boolean validationUpdates,
        Boolean rewardNotifications,
        Boolean governanceUpdates,
        Boolean marketplaceUpdates,
        PrivacyLevel privacyLevel
) {
}
