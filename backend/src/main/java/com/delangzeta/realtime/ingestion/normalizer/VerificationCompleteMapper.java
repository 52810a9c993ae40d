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

/**
 * Validation verdict, addressed to the submission owner. The log only names the submission, so the owner
 * comes from {@link CorrelationLookup}; an unknown submission yields no derived event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationCompleteMapper implements RawEventMapper {

    private final CorrelationLookup correlationLookup;

    @Override
    public String eventName() {
        return UniversalContractEvents.VERIFICATION_COMPLETE;
    }

    @Override
    public Optional<CanonicalEvent> derive(DecodedLog decoded, CanonicalEvent primary) {
        String submissionId = decoded.field("submissionId");
        Optional<String> owner = correlationLookup.findSubmissionOwner(submissionId);
        if (owner.isEmpty()) {
            log.warn("No owner for submission {} (event {}); skipping validation update",
                    submissionId, primary.getId());
            return Optional.empty();
        }
        Map<String, Object> payload = EventNormalizer.payload("verification_complete");
        payload.put("submissionId", submissionId);
        payload.put("finalScore", decoded.field("finalScore"));
        payload.put("approved", Boolean.TRUE.equals(decoded.fields().get("approved")));
        payload.put("validator", decoded.field("validator"));
        return Optional.of(EventNormalizer.derivedFrom(primary, EventKind.VALIDATION_UPDATE, EventPriority.HIGH)
                .subjectUserId(owner.get())
                .submissionId(submissionId)
                .payload(payload)
                .build());
    }
}
