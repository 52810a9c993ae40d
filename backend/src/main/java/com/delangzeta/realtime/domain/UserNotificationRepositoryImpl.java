package com.delangzeta.realtime.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.List;

@RequiredArgsConstructor
public class UserNotificationRepositoryImpl implements UserNotificationRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public List<UserNotification> findHistory(String userId, int limit, int offset) {
        Query query = new Query(Criteria.where("userId").is(userId))
                .with(Sort.by(Sort.Direction.DESC, "sentAt"))
                .skip(offset)
                .limit(limit);
        return mongoTemplate.find(query, UserNotification.class);
    }
}
