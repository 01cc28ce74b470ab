package com.agentbox.core.events;

import java.util.HashMap;
import java.util.Map;

/**
 * Discriminator of agent events, keyed by the {@code type} field of each
 * protocol line. Types the daemon does not recognise map to {@link #UNKNOWN};
 * they stay in the event log and raw turn archive but are not projected.
 */
public enum AgentEventType {
    TURN_START("turn_start"),
    TURN_END("turn_end"),
    MESSAGE_START("message_start"),
    MESSAGE_UPDATE("message_update"),
    MESSAGE_END("message_end"),
    TOOL_EXECUTION_START("tool_execution_start"),
    TOOL_EXECUTION_UPDATE("tool_execution_update"),
    TOOL_EXECUTION_END("tool_execution_end"),
    AGENT_END("agent_end"),
    UNKNOWN("unknown");

    private static final Map<String, AgentEventType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (AgentEventType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;

    AgentEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isMessage() {
        return this == MESSAGE_START || this == MESSAGE_UPDATE || this == MESSAGE_END;
    }

    public boolean isTool() {
        return this == TOOL_EXECUTION_START || this == TOOL_EXECUTION_UPDATE || this == TOOL_EXECUTION_END;
    }

    public static AgentEventType fromWire(String type) {
        if (type == null) {
            return UNKNOWN;
        }
        return BY_WIRE_NAME.getOrDefault(type, UNKNOWN);
    }
}
