package com.delangzeta.realtime.ingestion.pipeline;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.ingestion.connector.DecodedLog;
import com.delangzeta.realtime.ingestion.normalizer.EventNormalizer;
import com.delangzeta.realtime.ingestion.normalizer.NormalizationResult;
import com.delangzeta.realtime.ingestion.store.CanonicalEventStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Normalize, store, publish for one decoded log. Connectors call this and advance their cursor only
 * after it returns.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventIngestionPipeline {

    private final EventNormalizer normalizer;
    private final CanonicalEventStore store;

    /**
     * @return number of events published (0 when the log was already ingested and published)
     */
    public int ingest(DecodedLog decoded) {
        NormalizationResult result = normalizer.normalize(decoded);
        int stored = 0;
        for (CanonicalEvent event : result.events()) {
            if (store.storeAndPublish(event)) {
                stored++;
                log.debug("Ingested {} {} from {}#{}", event.getKind().wireName(), event.getId(),
                        decoded.blockNumber(), decoded.logIndex());
            }
        }
        return stored;
    }
}
