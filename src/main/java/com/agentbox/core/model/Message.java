package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * A conversational message reconstructed from agent events.
 * <p>
 * {@code id} is derived from a provider signature when one is available, so a
 * re-delivered message replaces its earlier copy instead of duplicating it.
 *
 * @param id        stable identity used for upserts
 * @param role      user, assistant, tool or system
 * @param text      visible text
 * @param thinking  reasoning text, empty when the agent sent none
 * @param toolCalls tool-call requests carried by the message
 * @param status    streaming until the message ends, then complete
 * @param cursor    cursor of the event that first produced the message
 * @param turnIndex turn the message belongs to, null before any turn exists
 * @param timestamp agent-provided timestamp in epoch ms, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
    String id,
    MessageRole role,
    String text,
    String thinking,
    List<ToolCallSummary> toolCalls,
    MessageStatus status,
    Long cursor,
    Integer turnIndex,
    Long timestamp
) {

    public Message {
        text = text != null ? text : "";
        thinking = thinking != null ? thinking : "";
        toolCalls = toolCalls != null ? List.copyOf(toolCalls) : List.of();
    }

    public boolean isComplete() {
        return status == MessageStatus.COMPLETE;
    }

    public Message withText(String newText, MessageStatus newStatus) {
        return new Message(id, role, newText, thinking, toolCalls, newStatus, cursor, turnIndex, timestamp);
    }

    public Message withStatus(MessageStatus newStatus) {
        return new Message(id, role, text, thinking, toolCalls, newStatus, cursor, turnIndex, timestamp);
    }

    public Message withTurnIndex(Integer newTurnIndex) {
        return new Message(id, role, text, thinking, toolCalls, status, cursor, newTurnIndex, timestamp);
    }
}
