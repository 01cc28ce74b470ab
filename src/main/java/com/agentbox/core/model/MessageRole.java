package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Conversational role of a {@link Message}. Agent-specific role names are folded
 * into these four by {@link #fromWire(String)}.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    TOOL,
    SYSTEM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    /**
     * Maps a protocol role to a role; {@code toolResult} is a tool message and
     * anything unrecognised is treated as assistant output.
     */
    public static MessageRole fromWire(String role) {
        if (role == null) {
            return ASSISTANT;
        }
        return switch (role) {
            case "user" -> USER;
            case "tool", "toolResult" -> TOOL;
            case "system" -> SYSTEM;
            default -> ASSISTANT;
        };
    }
}
