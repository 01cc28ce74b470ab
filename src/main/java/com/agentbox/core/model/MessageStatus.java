package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageStatus {
    PENDING,
    STREAMING,
    COMPLETE,
    ERROR;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
