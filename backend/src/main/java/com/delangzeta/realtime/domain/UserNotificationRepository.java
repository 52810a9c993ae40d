package com.delangzeta.realtime.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface UserNotificationRepository extends MongoRepository<UserNotification, String>, UserNotificationRepositoryCustom {

    Optional<UserNotification> findByIdAndUserId(String id, String userId);
}
