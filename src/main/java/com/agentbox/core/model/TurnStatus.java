package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TurnStatus {
    RUNNING,
    COMPLETED,
    INTERRUPTED;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
