package com.delangzeta.realtime.ingestion.normalizer;

import com.delangzeta.realtime.domain.CanonicalEvent;
import com.delangzeta.realtime.domain.EventKind;
import com.delangzeta.realtime.domain.EventPriority;
import com.delangzeta.realtime.ingestion.connector.DecodedLog;
import com.delangzeta.realtime.ingestion.connector.UniversalContractEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class CrossChainOperationMapper implements RawEventMapper {

    private final CorrelationLookup correlationLookup;

    @Override
    public String eventName() {
        return UniversalContractEvents.CROSS_CHAIN_OPERATION_COMPLETE;
    }

    @Override
    public Optional<CanonicalEvent> derive(DecodedLog decoded, CanonicalEvent primary) {
        String operationId = decoded.field("operationId");
        Optional<String> initiator = correlationLookup.findOperationInitiator(operationId);
        if (initiator.isEmpty()) {
            log.warn("No initiator for cross-chain operation {} (event {})", operationId, primary.getId());
            return Optional.empty();
        }
        Map<String, Object> payload = EventNormalizer.payload("crosschain_operation_complete");
        payload.put("operationId", operationId);
        payload.put("sourceChain", decoded.field("sourceChain"));
        payload.put("targetChain", decoded.field("targetChain"));
        payload.put("success", Boolean.TRUE.equals(decoded.fields().get("success")));
        payload.put("transactionHash", decoded.transactionHash());
        return Optional.of(EventNormalizer.derivedFrom(primary, EventKind.BLOCKCHAIN_EVENT, EventPriority.MEDIUM)
                .subjectUserId(initiator.get())
                .payload(payload)
                .build());
    }
}
