package com.delangzeta.realtime.ingestion.normalizer;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.ingestion.connector.DecodedLog;

import java.util.Optional;

/**
 * Derives the application-level event for one contract event name. Implementations are stateless apart
 * from correlation lookups; an empty result keeps only the primary event.
 */
public interface RawEventMapper {

    String eventName();

    Optional<CanonicalEvent> derive(DecodedLog decoded, CanonicalEvent primary);
}
