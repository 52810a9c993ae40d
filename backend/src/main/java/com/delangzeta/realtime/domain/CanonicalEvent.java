package com.delangzeta.realtime.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Unit of the pipeline. Append-only in canonical_events; no setters, copies go through {@link #toBuilder()}.
 * Chain coordinates are set only on events decoded from contract logs.
 */
@Document(collection = "canonical_events")
@CompoundIndexes({
        @CompoundIndex(name = "eventName_block", def = "{'eventName': 1, 'blockNumber': -1}"),
        @CompoundIndex(name = "subject_observedAt", def = "{'subjectUserId': 1, 'observedAt': -1}")
})
@Builder(toBuilder = true)
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@ToString(of = {"id", "kind", "subjectUserId", "priority"})
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class CanonicalEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private EventKind kind;
    private String subjectUserId;
    private String taskId;
    private String submissionId;
    private String sourceChain;
    private String contractAddress;
    private Long blockNumber;
    private String transactionHash;
    private Long logIndex;
    private String eventName;
    /** Kind-specific fields; always carries "action". */
    private Map<String, Object> payload;
    private EventPriority priority;
    /** TTL anchor: events expire 90 days after ingestion. */
    @Indexed(name = "observedAt_ttl", expireAfterSeconds = 7_776_000)
    private Instant observedAt;
    /** Storage-only: false between insert and a confirmed topic publish. Null on events stored without tracking. */
    @JsonIgnore
    private Boolean published;

    @JsonIgnore
    public String action() {
        Object action = payload == null ? null : payload.get("action");
        return action == null ? null : action.toString();
    }

    @JsonIgnore
    public boolean isChainOriginated() {
        return sourceChain != null && transactionHash != null;
    }
}
