package com.delangzeta.realtime.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Per-user notification switches. Id is the user id. A user without a document gets {@link #defaults(String)}.
 */
@Document(collection = "user_notification_preferences")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class NotificationPreference {

    @Id
    @EqualsAndHashCode.Include
    private String userId;
    private boolean enablePushNotifications = true;
    private boolean enableEmailNotifications = true;
    private boolean enableInAppNotifications = true;
    private boolean taskUpdates = true;
    private boolean validationUpdates = true;
    private boolean rewardNotifications = true;
    private boolean governanceUpdates;
    private boolean marketplaceUpdates;
    private PrivacyLevel privacyLevel = PrivacyLevel.PRIVATE;
    private Instant updatedAt;

    public static NotificationPreference defaults(String userId) {
        NotificationPreference p = new NotificationPreference();
        p.setUserId(userId);
        return p;
    }
}
