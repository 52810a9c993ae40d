package com.delangzeta.realtime.ingestion.normalizer;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.ingestion.connector.DecodedLog;
import com.delangzeta.realtime.ingestion.connector.UniversalContractEvents;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * New task on any chain. No subject: fan-out broadcasts it to interested users.
 */
@Component
public class TaskCreatedMapper implements RawEventMapper {

    @Override
    public String eventName() {
        return UniversalContractEvents.TASK_CREATED;
    }

    @Override
    public Optional<CanonicalEvent> derive(DecodedLog decoded, CanonicalEvent primary) {
        Map<String, Object> payload = EventNormalizer.payload("created");
        payload.put("taskId", decoded.field("taskId"));
        payload.put("creator", decoded.field("creator"));
        payload.put("reward", decoded.field("reward"));
        payload.put("paymentToken", decoded.field("paymentToken"));
        payload.put("sourceChain", decoded.field("sourceChainId"));
        payload.put("chain", decoded.chain());
        return Optional.of(EventNormalizer.derivedFrom(primary, EventKind.TASK_UPDATE, EventPriority.MEDIUM)
                .taskId(decoded.field("taskId"))
                .payload(payload)
                .build());
    }
}
