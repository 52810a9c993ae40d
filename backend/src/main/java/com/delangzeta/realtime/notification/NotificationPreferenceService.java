package com.delangzeta.realtime.notification;

import com.delangzeta.realtime.domain.NotificationPreference;
import com.delangzeta.realtime.domain.NotificationPreferenceRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

@Service
@RequiredArgsConstructor
public class NotificationPreferenceService {

    private final NotificationPreferenceRepository repository;
    private final Clock clock;

    /** Stored preferences, or the defaults when the user never saved any. */
    public NotificationPreference get(String userId) {
        return repository.findById(userId).orElseGet(() -> NotificationPreference.defaults(userId));
    }

    public NotificationPreference update(String userId, PreferenceUpdate update) {
        NotificationPreference p = get(userId);
        apply(update.enablePushNotifications(), p::setEnablePushNotifications);
        apply(update.enableEmailNotifications(), p::setEnableEmailNotifications);
        apply(update.enableInAppNotifications(), p::setEnableInAppNotifications);
        apply(update.taskUpdates(), p::setTaskUpdates);
        apply(update.validationUpdates(), p::setValidationUpdates);
        apply(update.rewardNotifications(), p::setRewardNotifications);
        apply(update.governanceUpdates(), p::setGovernanceUpdates);
        apply(update.marketplaceUpdates(), p::setMarketplaceUpdates);
        apply(update.privacyLevel(), p::setPrivacyLevel);
        p.setUpdatedAt(Instant.now(clock));
        return repository.save(p);
    }

    /** Users who asked for new-task pushes. Only users with stored preferences are considered. */
    public List<String> taskBroadcastAudience(int limit) {
        return repository.findByTaskUpdatesTrueAndEnablePushNotificationsTrue(PageRequest.of(0, Math.max(1, limit)))
                .stream()
                .map(NotificationPreference::getUserId)
                .toList();
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }
}
