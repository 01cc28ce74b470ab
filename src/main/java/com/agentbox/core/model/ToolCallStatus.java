package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ToolCallStatus {
    RUNNING,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
