package com.agentbox.core.events;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of a {@link SandboxEvent}: the daemon itself or the supervised agent process.
 */
public enum EventSource {
    DAEMON,
    AGENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }
}
