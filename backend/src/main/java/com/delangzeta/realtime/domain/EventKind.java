package com.delangzeta.realtime.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kind of a canonical event. The wire name is what clients and topic headers see.
 */
public enum EventKind {
    TASK_UPDATE("task_update"),
    SUBMISSION_UPDATE("submission_update"),
    VALIDATION_UPDATE("validation_update"),
    REWARD_DISTRIBUTED("reward_distributed"),
    BLOCKCHAIN_EVENT("blockchain_event");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventKind fromWireName(String value) {
        return Arrays.stream(values())
                .filter(k -> k.wireName.equals(value) || k.name().equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event kind: " + value));
    }
}
