package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One tool execution inside a turn.
 *
 * @param id        tool call id from the agent
 * @param toolName  tool name, "tool" when the agent omitted it
 * @param status    running, then done or error
 * @param cursor    cursor of the latest event about this call
 * @param startedAt epoch ms of the first event seen for this call
 * @param endedAt   epoch ms of the terminal event, null while running
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallRecord(
    String id,
    String toolName,
    ToolCallStatus status,
    long cursor,
    long startedAt,
    Long endedAt
) {

    public static ToolCallRecord firstSeen(String id, String toolName, ToolCallStatus status,
                                           long cursor, long timestamp) {
        return new ToolCallRecord(id, toolName, status, cursor, timestamp,
                status.isTerminal() ? timestamp : null);
    }

    /**
     * Applies a later event. A terminal status is never replaced and {@code endedAt}
     * is stamped only once.
     */
    public ToolCallRecord advance(ToolCallStatus next, String newToolName, long newCursor, long timestamp) {
        if (status.isTerminal()) {
            return new ToolCallRecord(id, newToolName, status, newCursor, startedAt, endedAt);
        }
        Long ended = next.isTerminal() ? Long.valueOf(timestamp) : null;
        return new ToolCallRecord(id, newToolName, next, newCursor, startedAt, ended);
    }
}
