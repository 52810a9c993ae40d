package com.delangzeta.realtime.ingestion.normalizer;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.ingestion.connector.DecodedLog;
import com.delangzeta.realtime.ingestion.connector.UniversalContractEvents;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Component
public class RewardDistributedMapper implements RawEventMapper {

    @Override
    public String eventName() {
        return UniversalContractEvents.REWARD_DISTRIBUTED;
    }

    @Override
    public Optional<CanonicalEvent> derive(DecodedLog decoded, CanonicalEvent primary) {
        Map<String, Object> payload = EventNormalizer.payload("reward_distributed");
        payload.put("recipient", decoded.field("recipient"));
        payload.put("amount", decoded.field("amount"));
        payload.put("token", decoded.field("token"));
        payload.put("sourceChain", decoded.field("sourceChain"));
        payload.put("targetChain", decoded.field("targetChain"));
        payload.put("transactionHash", decoded.transactionHash());
        return Optional.of(EventNormalizer.derivedFrom(primary, EventKind.REWARD_DISTRIBUTED, EventPriority.HIGH)
                .subjectUserId(decoded.field("recipient"))
                .payload(payload)
                .build());
    }
}
