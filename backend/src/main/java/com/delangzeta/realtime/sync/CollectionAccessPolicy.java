package com.delangzeta.realtime.sync;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which collections a user may read through sync and live listeners, and with which row filter.
 * Unknown collections are invisible.
 */
@Component
@RequiredArgsConstructor
public class CollectionAccessPolicy {

    public static final Set<String> USER_OWNED = Set.of(
            "user_profiles", "user_submissions", "user_validations",
            "user_rewards", "user_notifications", "user_preferences");
    public static final Set<String> PUBLIC = Set.of(
            "tasks", "marketplace_datasets", "governance_proposals", "platform_stats");
    private static final Map<String, CollectionAccess> ROLE_GATED = Map.of(
            "validations", CollectionAccess.VALIDATOR_ONLY,
            "admin_logs", CollectionAccess.ADMIN_ONLY);

    private final UserProfileLookup profileLookup;

    public CollectionAccess classify(String collection) {
        if (USER_OWNED.contains(collection)) {
            return CollectionAccess.USER_OWNED;
        }
        if (PUBLIC.contains(collection)) {
            return CollectionAccess.PUBLIC;
        }
        return ROLE_GATED.getOrDefault(collection, CollectionAccess.NONE);
    }

    /**
     * Row filter for the user on the collection, or empty when the collection is not visible to them.
     */
    public Optional<Criteria> readScope(String userId, String collection) {
        return switch (classify(collection)) {
            case USER_OWNED -> Optional.of(Criteria.where("userId").is(userId));
            case PUBLIC -> Optional.of(new Criteria());
            case VALIDATOR_ONLY -> profileLookup.find(userId).filter(UserProfile::validator).map(p -> new Criteria());
            case ADMIN_ONLY -> profileLookup.find(userId).filter(UserProfile::isAdmin).map(p -> new Criteria());
            case NONE -> Optional.empty();
        };
    }

    public boolean canRead(String userId, String collection) {
        return readScope(userId, collection).isPresent();
    }
}
