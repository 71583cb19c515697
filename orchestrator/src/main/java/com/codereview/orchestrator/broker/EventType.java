package com.codereview.orchestrator.broker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of progress notification. Serialized as its wire name.
 */
public enum EventType {
    STAGE_UPDATE("stage_update"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this != STAGE_UPDATE;
    }
}
