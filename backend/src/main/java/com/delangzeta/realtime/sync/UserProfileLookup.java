package com.delangzeta.realtime.sync;

import com.delangzeta.realtime.config.CaffeineConfig;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Role flags from user_profiles (document id = user id), cached for a few minutes.
 */
@Component
@RequiredArgsConstructor
public class UserProfileLookup {

    static final String USER_PROFILES = "user_profiles";

    private final MongoTemplate mongoTemplate;

    @Cacheable(cacheNames = CaffeineConfig.USER_PROFILE_CACHE, unless = "#result == null")
    public Optional<UserProfile> find(String userId) {
        Query query = new Query(Criteria.where("_id").is(userId));
        query.fields().include("isValidator").include("role");
        Document doc = mongoTemplate.findOne(query, Document.class, USER_PROFILES);
        if (doc == null) {
            return Optional.empty();
        }
        return Optional.of(new UserProfile(userId, Boolean.TRUE.equals(doc.getBoolean("isValidator")), doc.getString("role")));
    }
}
