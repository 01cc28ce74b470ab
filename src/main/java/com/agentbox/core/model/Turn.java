package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * One human-visible unit of agent work, possibly spanning several tool-use rounds.
 *
 * @param index                   1-based, sequential per sandbox
 * @param status                  running until closed, then completed or interrupted
 * @param startedAt               epoch ms of the opening event
 * @param endedAt                 epoch ms of the closing event, set once
 * @param toolCalls               tool executions in first-seen order
 * @param timeline                tool and message trace items in first-seen order
 * @param userMessageId           the user message that opened the turn, if any
 * @param finalAssistantMessageId last complete assistant message at close
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Turn(
    int index,
    TurnStatus status,
    long startedAt,
    Long endedAt,
    List<ToolCallRecord> toolCalls,
    List<TraceItem> timeline,
    String userMessageId,
    String finalAssistantMessageId
) {

    public Turn {
        toolCalls = List.copyOf(toolCalls);
        timeline = List.copyOf(timeline);
    }

    public static Turn open(int index, long startedAt) {
        return new Turn(index, TurnStatus.RUNNING, startedAt, null, List.of(), List.of(), null, null);
    }

    public boolean isRunning() {
        return status == TurnStatus.RUNNING;
    }

    /**
     * Inserts or replaces the tool call with the same id, and keeps exactly one
     * timeline item for it.
     */
    public Turn upsertToolCall(ToolCallRecord call) {
        List<ToolCallRecord> calls = new ArrayList<>(toolCalls);
        int idx = indexOfCall(call.id());
        if (idx == -1) {
            calls.add(call);
        } else {
            calls.set(idx, call);
        }
        TraceItem item = TraceItem.tool(call);
        List<TraceItem> items = replaceOrAppend(t -> t.isToolCall(call.id()), item);
        return new Turn(index, status, startedAt, endedAt, calls, items, userMessageId, finalAssistantMessageId);
    }

    public Turn upsertMessageTrace(Message message) {
        List<TraceItem> items = replaceOrAppend(t -> t.isMessage(message.id()), TraceItem.message(message));
        String userId = userMessageId == null && message.role() == MessageRole.USER ? message.id() : userMessageId;
        return new Turn(index, status, startedAt, endedAt, toolCalls, items, userId, finalAssistantMessageId);
    }

    public Turn close(TurnStatus terminal, long closedAt, String finalAssistantId) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException("Cannot close turn " + index + " as " + terminal);
        }
        if (!isRunning()) {
            throw new IllegalStateException("Turn " + index + " is already " + status.wireName());
        }
        return new Turn(index, terminal, startedAt, closedAt, toolCalls, timeline, userMessageId,
                finalAssistantId != null ? finalAssistantId : finalAssistantMessageId);
    }

    public Turn withFinalAssistantMessageId(String messageId) {
        return new Turn(index, status, startedAt, endedAt, toolCalls, timeline, userMessageId, messageId);
    }

    public ToolCallRecord findToolCall(String callId) {
        int idx = indexOfCall(callId);
        return idx == -1 ? null : toolCalls.get(idx);
    }

    private int indexOfCall(String callId) {
        for (int i = 0; i < toolCalls.size(); i++) {
            if (toolCalls.get(i).id().equals(callId)) {
                return i;
            }
        }
        return -1;
    }

    private List<TraceItem> replaceOrAppend(Predicate<TraceItem> match, TraceItem item) {
        List<TraceItem> items = new ArrayList<>(timeline);
        for (int i = 0; i < items.size(); i++) {
            if (match.test(items.get(i))) {
                items.set(i, item);
                return items;
            }
        }
        items.add(item);
        return items;
    }
}
