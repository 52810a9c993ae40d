package com.delangzeta.realtime.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for canonical_events. Writes go through CanonicalEventStore (insert plus the publish marker);
 * the history query lives in {@link CanonicalEventRepositoryCustom}.
 */
public interface CanonicalEventRepository extends MongoRepository<CanonicalEvent, String>, CanonicalEventRepositoryCustom {

    /** A stored event whose publication was never confirmed. */
    Optional<CanonicalEvent> findByIdAndPublishedFalse(String id);
}
