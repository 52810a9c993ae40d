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
public class DataSubmittedMapper implements RawEventMapper {

    @Override
    public String eventName() {
        return UniversalContractEvents.DATA_SUBMITTED;
    }

    @Override
    public Optional<CanonicalEvent> derive(DecodedLog decoded, CanonicalEvent primary) {
        Map<String, Object> payload = EventNormalizer.payload("submitted");
        payload.put("submissionId", decoded.field("submissionId"));
        payload.put("contributor", decoded.field("contributor"));
        payload.put("storageUrl", decoded.field("storageUrl"));
        payload.put("preferredRewardChain", decoded.field("preferredRewardChain"));
        payload.put("chain", decoded.chain());
        return Optional.of(EventNormalizer.derivedFrom(primary, EventKind.SUBMISSION_UPDATE, EventPriority.MEDIUM)
                .subjectUserId(decoded.field("contributor"))
                .submissionId(decoded.field("submissionId"))
                .payload(payload)
                .build());
    }
}
