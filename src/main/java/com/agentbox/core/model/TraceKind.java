package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TraceKind {
    TOOL,
    MESSAGE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
