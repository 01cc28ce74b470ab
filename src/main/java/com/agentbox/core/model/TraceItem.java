package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One entry on a turn's timeline: a tool execution or a completed message.
 * Each tool call id and each message id appears at most once per turn.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceItem(
    String id,
    TraceKind kind,
    String toolCallId,
    String toolName,
    ToolCallStatus toolStatus,
    String messageId,
    MessageRole role,
    String text,
    long cursor,
    Long timestamp
) {

    public static TraceItem tool(ToolCallRecord call) {
        return new TraceItem("trace-tool-" + call.id(), TraceKind.TOOL, call.id(), call.toolName(),
                call.status(), null, null, null, call.cursor(), call.startedAt());
    }

    public static TraceItem message(Message message) {
        long cursor = message.cursor() != null ? message.cursor() : 0L;
        return new TraceItem("trace-msg-" + message.id(), TraceKind.MESSAGE, null, null, null,
                message.id(), message.role(), message.text(), cursor, message.timestamp());
    }

    public boolean isToolCall(String callId) {
        return kind == TraceKind.TOOL && callId.equals(toolCallId);
    }

    public boolean isMessage(String id) {
        return kind == TraceKind.MESSAGE && id.equals(messageId);
    }
}
