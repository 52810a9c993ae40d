package com.delangzeta.realtime.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;

public interface DeviceTokenRepository extends MongoRepository<DeviceToken, String> {

    List<DeviceToken> findByUserIdAndActiveTrue(String userId);

    List<DeviceToken> findByUserIdAndTokenIn(String userId, Collection<String> tokens);
}
