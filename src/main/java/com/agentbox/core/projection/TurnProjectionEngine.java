package com.agentbox.core.projection;

import com.agentbox.core.events.AgentEventType;
import com.agentbox.core.events.EventRecord;
import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.metrics.DaemonMetrics;
import com.agentbox.core.model.ClosedTurn;
import com.agentbox.core.model.Message;
import com.agentbox.core.model.MessageRole;
import com.agentbox.core.model.MessageStatus;
import com.agentbox.core.model.ProjectionSnapshot;
import com.agentbox.core.model.ToolCallRecord;
import com.agentbox.core.model.ToolCallStatus;
import com.agentbox.core.model.Turn;
import com.agentbox.core.model.TurnStatus;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Folds the event log into turns, messages and tool calls.
 * <p>
 * Records must be applied in cursor order; a record at or below the last applied
 * cursor is ignored. The projection reads no clock: every timestamp comes from the
 * events, so replaying the same sequence always yields the same state.
 * <p>
 * Turn-closed listeners run after the state update, outside the engine's monitor.
 */
@Component
public class TurnProjectionEngine {

    private static final Logger log = LoggerFactory.getLogger(TurnProjectionEngine.class);

    public static final String STATUS_IDLE = "Idle";
    public static final String STATUS_RESPONDING = "Responding";

    public static final String TURN_INTERRUPTED = "turn_interrupted";
    public static final String SANDBOX_TERMINATED = "sandbox_terminated";

    private final DaemonMetrics metrics;
    private final List<TurnClosedListener> listeners = new CopyOnWriteArrayList<>();

    private final List<Turn> turns = new ArrayList<>();
    private final Map<String, Message> messages = new LinkedHashMap<>();
    private final List<SandboxEvent> activeTurnEvents = new ArrayList<>();
    private Integer activeTurnIndex;
    /** Interrupted turn still receiving the agent's late shutdown events; its ClosedTurn is held back. */
    private Integer drainingTurnIndex;
    private int nextTurnIndex = 1;
    private String agentStatus = STATUS_IDLE;
    private long lastCursor;

    public TurnProjectionEngine() {
        this(null);
    }

    @Autowired
    public TurnProjectionEngine(@Autowired(required = false) DaemonMetrics metrics) {
        this.metrics = metrics;
    }

    public void addTurnClosedListener(TurnClosedListener listener) {
        listeners.add(listener);
    }

    /**
     * Applies one record. Suitable as an {@code EventLog} subscriber.
     */
    public void apply(EventRecord record) {
        List<ClosedTurn> closed = new ArrayList<>();
        synchronized (this) {
            if (record.cursor() <= lastCursor) {
                log.debug("Ignoring cursor {} at or below last applied cursor {}", record.cursor(), lastCursor);
                return;
            }
            lastCursor = record.cursor();
            SandboxEvent event = record.event();
            if (event.isAgent()) {
                applyAgentEvent(record.cursor(), event, closed);
            } else {
                applyDaemonEvent(event, closed);
            }
        }
        for (ClosedTurn closedTurn : closed) {
            publish(closedTurn);
        }
    }

    public synchronized ProjectionSnapshot snapshot() {
        return new ProjectionSnapshot(turns, new ArrayList<>(messages.values()), activeTurnIndex,
                agentStatus, lastCursor);
    }

    public synchronized void reset() {
        turns.clear();
        messages.clear();
        activeTurnEvents.clear();
        activeTurnIndex = null;
        drainingTurnIndex = null;
        nextTurnIndex = 1;
        agentStatus = STATUS_IDLE;
        lastCursor = 0;
    }

    // -- Agent events ---

    private void applyAgentEvent(long cursor, SandboxEvent event, List<ClosedTurn> closed) {
        AgentEventType type = event.agentType();
        ObjectNode payload = event.payload();
        long timestamp = eventTimestamp(event);

        if (drainingTurnIndex != null) {
            if (type == AgentEventType.TURN_START || (type.isMessage() && isUserMessage(payload))) {
                finishDraining(closed);
            } else {
                applyLateEvent(type, cursor, event, timestamp, closed);
                return;
            }
        }

        switch (type) {
            case TURN_START -> {
                ensureActiveTurn(timestamp);
                activeTurnEvents.add(event);
                agentStatus = STATUS_RESPONDING;
            }
            case MESSAGE_START, MESSAGE_UPDATE, MESSAGE_END -> {
                ensureActiveTurn(timestamp);
                activeTurnEvents.add(event);
                applyMessage(type, cursor, payload, activeTurnIndex);
                agentStatus = STATUS_RESPONDING;
            }
            case TOOL_EXECUTION_START, TOOL_EXECUTION_UPDATE, TOOL_EXECUTION_END -> {
                ensureActiveTurn(timestamp);
                activeTurnEvents.add(event);
                applyTool(type, cursor, payload, timestamp, activeTurnIndex);
            }
            case TURN_END -> applyTurnEnd(cursor, event, timestamp, closed);
            case AGENT_END -> {
                recordForActiveTurn(event);
                flushStreamingMessages();
                if (activeTurnIndex != null) {
                    closed.add(closeActiveTurn(TurnStatus.COMPLETED, timestamp));
                }
                agentStatus = STATUS_IDLE;
            }
            case UNKNOWN -> recordForActiveTurn(event);
        }
    }

    /**
     * Events the agent emits after an abort while it winds down belong to the
     * interrupted turn. Its {@code turn_end} or {@code agent_end} releases the turn
     * to the listeners.
     */
    private void applyLateEvent(AgentEventType type, long cursor, SandboxEvent event, long timestamp,
                                List<ClosedTurn> closed) {
        ObjectNode payload = event.payload();
        activeTurnEvents.add(event);
        switch (type) {
            case MESSAGE_START, MESSAGE_UPDATE, MESSAGE_END -> applyMessage(type, cursor, payload, drainingTurnIndex);
            case TOOL_EXECUTION_START, TOOL_EXECUTION_UPDATE, TOOL_EXECUTION_END ->
                    applyTool(type, cursor, payload, timestamp, drainingTurnIndex);
            case TURN_END -> {
                upsertTurnEndMessage(cursor, payload, drainingTurnIndex);
                finishDraining(closed);
            }
            case AGENT_END -> finishDraining(closed);
            default -> { }
        }
        agentStatus = STATUS_IDLE;
    }

    private static boolean isUserMessage(ObjectNode payload) {
        JsonNode message = payload.get("message");
        String role = message != null && message.isObject()
                ? MessageParts.textOrNull(message, "role")
                : MessageParts.textOrNull(payload, "role");
        return MessageRole.fromWire(role) == MessageRole.USER;
    }

    private void applyMessage(AgentEventType type, long cursor, ObjectNode payload, Integer turnIndex) {
        MessageStatus status = type == AgentEventType.MESSAGE_END ? MessageStatus.COMPLETE : MessageStatus.STREAMING;
        JsonNode message = payload.get("message");

        if (message != null && message.isObject()) {
            MessageParts parts = MessageParts.from(message);
            Message upserted = upsertMessage(new Message(parts.identity(cursor), parts.role(), parts.text(),
                    parts.thinking(), parts.toolCalls(), status, cursor, turnIndex, parts.timestamp()));
            if (upserted.isComplete()) {
                traceMessage(upserted);
            }
            return;
        }

        applyTextDelta(type, cursor, payload, status, turnIndex);
    }

    /**
     * Handles streams that send bare {@code text}/{@code delta} chunks instead of a
     * {@code message} object. Chunks merge into the last streaming message of the
     * same role.
     */
    private void applyTextDelta(AgentEventType type, long cursor, ObjectNode payload, MessageStatus status,
                                Integer turnIndex) {
        String delta = MessageParts.textOrNull(payload, "text");
        if (delta == null) {
            delta = MessageParts.textOrNull(payload, "delta");
        }
        if (delta == null) {
            delta = "";
        }
        if (delta.isEmpty() && type != AgentEventType.MESSAGE_END) {
            return;
        }

        MessageRole role = MessageRole.fromWire(MessageParts.textOrNull(payload, "role"));
        Message existing = lastStreamingMessage(role);

        Message updated;
        if (existing == null) {
            if (delta.isEmpty()) {
                return;
            }
            JsonNode ts = payload.get("timestamp");
            updated = new Message("pi-msg-" + cursor + "-" + role.wireName(), role, delta, "", List.of(),
                    status, cursor, turnIndex, ts != null && ts.isNumber() ? ts.asLong() : null);
        } else {
            Integer kept = existing.turnIndex() != null ? existing.turnIndex() : turnIndex;
            updated = existing.withText(mergeText(existing.text(), delta), status).withTurnIndex(kept);
        }
        messages.put(updated.id(), updated);
        if (updated.isComplete()) {
            traceMessage(updated);
        }
    }

    /**
     * A chunk that extends the accumulated text replaces it; a chunk the accumulated
     * text already starts with is stale; anything else is appended.
     */
    static String mergeText(String existing, String delta) {
        if (delta.isEmpty()) {
            return existing;
        }
        if (!existing.isEmpty() && delta.length() >= existing.length() && delta.startsWith(existing)) {
            return delta;
        }
        if (!existing.isEmpty() && existing.startsWith(delta)) {
            return existing;
        }
        return existing + delta;
    }

    private void applyTool(AgentEventType type, long cursor, ObjectNode payload, long timestamp, int turnIndex) {
        String callId = MessageParts.textOrNull(payload, "toolCallId");
        if (callId == null) {
            callId = MessageParts.textOrNull(payload, "id");
        }
        if (callId == null || callId.isEmpty()) {
            callId = "tool-" + cursor;
        }
        String toolName = MessageParts.textOrNull(payload, "toolName");
        if (toolName == null) {
            toolName = MessageParts.textOrNull(payload, "name");
        }

        ToolCallStatus status = ToolCallStatus.RUNNING;
        if (type == AgentEventType.TOOL_EXECUTION_END) {
            status = payload.path("isError").asBoolean(false) ? ToolCallStatus.ERROR : ToolCallStatus.DONE;
        }

        Turn turn = findTurn(turnIndex);
        ToolCallRecord existing = turn.findToolCall(callId);
        ToolCallRecord next = existing == null
                ? ToolCallRecord.firstSeen(callId, toolName != null ? toolName : "tool", status, cursor, timestamp)
                : existing.advance(status, toolName != null ? toolName : existing.toolName(), cursor, timestamp);
        replaceTurn(turn.upsertToolCall(next));

        agentStatus = type == AgentEventType.TOOL_EXECUTION_END ? STATUS_IDLE : "Running " + next.toolName();
    }

    private void applyTurnEnd(long cursor, SandboxEvent event, long timestamp, List<ClosedTurn> closed) {
        ObjectNode payload = event.payload();
        recordForActiveTurn(event);

        Integer targetTurn = activeTurnIndex;
        if (targetTurn == null && !turns.isEmpty()) {
            targetTurn = turns.get(turns.size() - 1).index();
        }

        MessageParts parts = upsertTurnEndMessage(cursor, payload, targetTurn);
        flushStreamingMessages();

        if (activeTurnIndex == null) {
            agentStatus = STATUS_IDLE;
            return;
        }
        if (isContinuation(payload, parts)) {
            log.debug("turn_end at cursor {} continues turn {}", cursor, activeTurnIndex);
            agentStatus = STATUS_RESPONDING;
            return;
        }
        closed.add(closeActiveTurn(TurnStatus.COMPLETED, timestamp));
        agentStatus = STATUS_IDLE;
    }

    private MessageParts upsertTurnEndMessage(long cursor, ObjectNode payload, Integer turnIndex) {
        JsonNode message = payload.get("message");
        MessageParts parts = message != null && message.isObject() ? MessageParts.from(message) : null;
        if (parts != null) {
            Message upserted = upsertMessage(new Message(parts.identity(cursor), parts.role(), parts.text(),
                    parts.thinking(), parts.toolCalls(), MessageStatus.COMPLETE, cursor, turnIndex,
                    parts.timestamp()));
            traceMessage(upserted);
        }
        return parts;
    }

    private static boolean isContinuation(ObjectNode payload, MessageParts parts) {
        if (isToolUse(MessageParts.textOrNull(payload, "stopReason"))) {
            return true;
        }
        return parts != null && (isToolUse(parts.stopReason()) || parts.hasToolCalls());
    }

    private static boolean isToolUse(String stopReason) {
        return "toolUse".equals(stopReason) || "tool_use".equals(stopReason);
    }

    // -- Daemon events ---

    private void applyDaemonEvent(SandboxEvent event, List<ClosedTurn> closed) {
        String type = event.type();
        if (!TURN_INTERRUPTED.equals(type) && !SANDBOX_TERMINATED.equals(type)) {
            return;
        }
        if (activeTurnIndex != null) {
            flushStreamingMessages();
            Turn interrupted = markActiveTurnClosed(TurnStatus.INTERRUPTED, eventTimestamp(event));
            if (TURN_INTERRUPTED.equals(type)) {
                drainingTurnIndex = interrupted.index();
            } else {
                closed.add(takeClosedTurn(interrupted.index()));
            }
        } else if (drainingTurnIndex != null && SANDBOX_TERMINATED.equals(type)) {
            finishDraining(closed);
        }
        agentStatus = STATUS_IDLE;
    }

    // -- State helpers ---

    private void ensureActiveTurn(long timestamp) {
        if (activeTurnIndex != null) {
            return;
        }
        Turn turn = Turn.open(nextTurnIndex++, timestamp);
        turns.add(turn);
        activeTurnIndex = turn.index();
        activeTurnEvents.clear();
        log.debug("Opened turn {}", turn.index());
    }

    private void recordForActiveTurn(SandboxEvent event) {
        if (activeTurnIndex != null) {
            activeTurnEvents.add(event);
        }
    }

    private ClosedTurn closeActiveTurn(TurnStatus status, long timestamp) {
        return takeClosedTurn(markActiveTurnClosed(status, timestamp).index());
    }

    private Turn markActiveTurnClosed(TurnStatus status, long timestamp) {
        Turn turn = activeTurn();
        Turn closedTurn = turn.close(status, timestamp, finalAssistantMessageId(turn.index()));
        replaceTurn(closedTurn);
        activeTurnIndex = null;
        log.debug("Closed turn {} as {}", closedTurn.index(), status.wireName());
        if (metrics != null) {
            metrics.recordTurnClosed(status);
        }
        return closedTurn;
    }

    private ClosedTurn takeClosedTurn(int turnIndex) {
        ClosedTurn result = new ClosedTurn(findTurn(turnIndex), activeTurnEvents);
        activeTurnEvents.clear();
        return result;
    }

    private void finishDraining(List<ClosedTurn> closed) {
        int turnIndex = drainingTurnIndex;
        drainingTurnIndex = null;
        flushStreamingMessages();
        String finalId = finalAssistantMessageId(turnIndex);
        if (finalId != null) {
            replaceTurn(findTurn(turnIndex).withFinalAssistantMessageId(finalId));
        }
        closed.add(takeClosedTurn(turnIndex));
        log.debug("Interrupted turn {} released after the agent wound down", turnIndex);
    }

    private String finalAssistantMessageId(int turnIndex) {
        String finalId = null;
        for (Message message : messages.values()) {
            if (message.role() == MessageRole.ASSISTANT && message.isComplete()
                    && Integer.valueOf(turnIndex).equals(message.turnIndex())) {
                finalId = message.id();
            }
        }
        return finalId;
    }

    /**
     * Inserts or replaces a message by id. The first cursor and turn index are kept,
     * and a complete message is never downgraded by a late streaming update.
     */
    private Message upsertMessage(Message incoming) {
        Message existing = messages.get(incoming.id());
        if (existing == null) {
            messages.put(incoming.id(), incoming);
            return incoming;
        }
        if (existing.isComplete() && incoming.status() == MessageStatus.STREAMING) {
            return existing;
        }
        Message merged = new Message(existing.id(), incoming.role(), incoming.text(), incoming.thinking(),
                incoming.toolCalls(), incoming.status(), existing.cursor(),
                existing.turnIndex() != null ? existing.turnIndex() : incoming.turnIndex(),
                incoming.timestamp() != null ? incoming.timestamp() : existing.timestamp());
        messages.put(merged.id(), merged);
        return merged;
    }

    private void flushStreamingMessages() {
        List<Message> flushed = new ArrayList<>();
        for (Message message : messages.values()) {
            if (message.status() == MessageStatus.STREAMING) {
                flushed.add(message.withStatus(MessageStatus.COMPLETE));
            }
        }
        for (Message message : flushed) {
            messages.put(message.id(), message);
            traceMessage(message);
        }
    }

    private void traceMessage(Message message) {
        if (message.turnIndex() == null) {
            return;
        }
        Turn turn = findTurn(message.turnIndex());
        if (turn != null) {
            replaceTurn(turn.upsertMessageTrace(message));
        }
    }

    private Message lastStreamingMessage(MessageRole role) {
        Message last = null;
        for (Message message : messages.values()) {
            if (message.status() == MessageStatus.STREAMING && message.role() == role) {
                last = message;
            }
        }
        return last;
    }

    private Turn activeTurn() {
        return findTurn(activeTurnIndex);
    }

    private Turn findTurn(int index) {
        for (Turn turn : turns) {
            if (turn.index() == index) {
                return turn;
            }
        }
        return null;
    }

    private void replaceTurn(Turn updated) {
        for (int i = 0; i < turns.size(); i++) {
            if (turns.get(i).index() == updated.index()) {
                turns.set(i, updated);
                return;
            }
        }
    }

    private static long eventTimestamp(SandboxEvent event) {
        JsonNode ts = event.payload().get("timestamp");
        return ts != null && ts.isNumber() ? ts.asLong() : event.timestamp();
    }

    private void publish(ClosedTurn closedTurn) {
        for (TurnClosedListener listener : listeners) {
            try {
                listener.onTurnClosed(closedTurn);
            } catch (Exception e) {
                log.warn("Turn-closed listener failed for turn {}: {}", closedTurn.index(), e.getMessage(), e);
            }
        }
    }
}
