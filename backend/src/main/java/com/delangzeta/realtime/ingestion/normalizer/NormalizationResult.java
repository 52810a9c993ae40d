package com.delangzeta.realtime.ingestion.normalizer;

import com.delangzeta.realtime.domain.CanonicalEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Primary chain event plus the optional derived application event.
 */
public record NormalizationResult(CanonicalEvent primary, CanonicalEvent derived) {

    /** Primary first; store and publish in this order. */
    public List<CanonicalEvent> events() {
        if (derived == null) {
            return Collections.singletonList(primary);
        }
        List<CanonicalEvent> events = new ArrayList<>(2);
        events.add(primary);
        events.add(derived);
        return events;
    }
}
