package com.delangzeta.realtime.domain;

import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface NotificationPreferenceRepository extends MongoRepository<NotificationPreference, String> {

    /** Broadcast audience for new tasks. */
    List<NotificationPreference> findByTaskUpdatesTrueAndEnablePushNotificationsTrue(Pageable pageable);
}
