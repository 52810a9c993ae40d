package com.delangzeta.realtime.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

public interface SessionTokenRepository extends MongoRepository<SessionToken, String> {
}
