package com.delangzeta.realtime.ingestion.normalizer;

import com.delangzeta.realtime.common.IdempotencyKeys;
import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.ingestion.connector.DecodedLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns a decoded contract log into a primary BLOCKCHAIN_EVENT and, through the mapper registered for the
 * event name, at most one derived application event. Ids and kinds depend only on the log.
 */
@Slf4j
@Component
public class EventNormalizer {

    public static final String PRIMARY_ACTION = "contract_event";

    private final Map<String, RawEventMapper> mappers;
    private final Clock clock;

    public EventNormalizer(List<RawEventMapper> mappers, Clock clock) {
        this.mappers = mappers.stream().collect(Collectors.toMap(RawEventMapper::eventName, Function.identity()));
        this.clock = clock;
    }

    public NormalizationResult normalize(DecodedLog decoded) {
        CanonicalEvent primary = primaryEvent(decoded, Instant.now(clock));
        RawEventMapper mapper = mappers.get(decoded.eventName());
        if (mapper == null) {
            log.debug("No derivation registered for {}", decoded.eventName());
            return new NormalizationResult(primary, null);
        }
        Optional<CanonicalEvent> derived = mapper.derive(decoded, primary);
        return new NormalizationResult(primary, derived.orElse(null));
    }

    static CanonicalEvent primaryEvent(DecodedLog decoded, Instant observedAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", PRIMARY_ACTION);
        payload.put("eventName", decoded.eventName());
        payload.put("chain", decoded.chain());
        payload.put("args", new LinkedHashMap<>(decoded.fields()));
        return CanonicalEvent.builder()
                .id(IdempotencyKeys.chainLog(decoded.chain(), decoded.transactionHash(), decoded.logIndex()))
                .kind(EventKind.BLOCKCHAIN_EVENT)
                .taskId(decoded.field("taskId"))
                .submissionId(decoded.field("submissionId"))
                .sourceChain(decoded.chain())
                .contractAddress(decoded.contractAddress())
                .blockNumber(decoded.blockNumber())
                .transactionHash(decoded.transactionHash())
                .logIndex(decoded.logIndex())
                .eventName(decoded.eventName())
                .payload(payload)
                .priority(EventPriority.LOW)
                .observedAt(observedAt)
                .build();
    }

    /**
     * Builder for an event derived from {@code primary}: id, kind, priority and observedAt are filled in.
     */
    public static CanonicalEvent.CanonicalEventBuilder derivedFrom(CanonicalEvent primary, EventKind kind, EventPriority priority) {
        return CanonicalEvent.builder()
                .id(IdempotencyKeys.contentHash("derived", kind.wireName(), primary.getId()))
                .kind(kind)
                .priority(priority)
                .observedAt(primary.getObservedAt());
    }

    public static Map<String, Object> payload(String action) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        return payload;
    }
}
