package com.agentbox.core.projection;

import com.agentbox.core.events.EventRecord;
import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.model.ClosedTurn;
import com.agentbox.core.model.MessageRole;
import com.agentbox.core.model.MessageStatus;
import com.agentbox.core.model.ProjectionSnapshot;
import com.agentbox.core.model.ToolCallStatus;
import com.agentbox.core.model.TraceKind;
import com.agentbox.core.model.TurnStatus;
import com.agentbox.core.persistence.TurnMessageConverter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link TurnProjectionEngine}.
 */
class TurnProjectionEngineTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TurnProjectionEngine engine;
    private List<ClosedTurn> closedTurns;
    private long cursor;

    @BeforeEach
    void setUp() {
        engine = new TurnProjectionEngine(null);
        closedTurns = new ArrayList<>();
        engine.addTurnClosedListener(closedTurns::add);
        cursor = 0;
    }

    private EventRecord agent(String json) {
        try {
            ObjectNode line = (ObjectNode) MAPPER.readTree(json);
            cursor++;
            return new EventRecord(cursor, SandboxEvent.agent(line, 1_000L + cursor));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(json, e);
        }
    }

    private EventRecord daemon(String type) {
        cursor++;
        return new EventRecord(cursor, SandboxEvent.daemon(type, 1_000L + cursor));
    }

    private void applyAll(List<EventRecord> records) {
        records.forEach(engine::apply);
    }

    private List<EventRecord> endToEndScenario() {
        return List.of(
                agent("{\"type\":\"turn_start\"}"),
                agent("{\"type\":\"message_end\",\"role\":\"user\",\"text\":\"hi\"}"),
                agent("{\"type\":\"tool_execution_start\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"),
                agent("{\"type\":\"tool_execution_end\",\"toolCallId\":\"t1\"}"),
                agent("{\"type\":\"message_end\",\"role\":\"assistant\",\"text\":\"done\"}"),
                agent("{\"type\":\"turn_end\",\"stopReason\":\"endTurn\"}"));
    }

    // -- End-to-end tests -----------------------------------------------------

    @Nested
    @DisplayName("end to end")
    class EndToEndTests {

        @Test
        @DisplayName("a full turn yields one completed turn with one done tool call")
        void fullTurn() {
            applyAll(endToEndScenario());

            ProjectionSnapshot snapshot = engine.snapshot();
            assertEquals(1, snapshot.turns().size());
            var turn = snapshot.turns().get(0);
            assertEquals(1, turn.index());
            assertEquals(TurnStatus.COMPLETED, turn.status());
            assertEquals(1, turn.toolCalls().size());
            assertEquals("t1", turn.toolCalls().get(0).id());
            assertEquals("bash", turn.toolCalls().get(0).toolName());
            assertEquals(ToolCallStatus.DONE, turn.toolCalls().get(0).status());

            var finalMessage = snapshot.message(turn.finalAssistantMessageId());
            assertNotNull(finalMessage);
            assertEquals("done", finalMessage.text());
            assertEquals(MessageRole.ASSISTANT, finalMessage.role());

            var userMessage = snapshot.message(turn.userMessageId());
            assertEquals("hi", userMessage.text());
            assertNull(snapshot.activeTurnIndex());
            assertEquals(TurnProjectionEngine.STATUS_IDLE, snapshot.agentStatus());
        }

        @Test
        @DisplayName("closed turn is published with the raw agent events in order")
        void publishesClosedTurn() {
            applyAll(endToEndScenario());

            assertEquals(1, closedTurns.size());
            var closed = closedTurns.get(0);
            assertEquals(1, closed.index());
            assertEquals(6, closed.events().size());
            assertEquals("turn_start", closed.events().get(0).type());
            assertEquals("turn_end", closed.events().get(5).type());
        }

        @Test
        @DisplayName("replaying the same sequence twice produces identical state")
        void deterministicReplay() {
            var events = new ArrayList<>(endToEndScenario());
            events.add(agent("{\"type\":\"message_update\",\"role\":\"user\",\"text\":\"again\"}"));
            events.add(agent("{\"type\":\"message_update\",\"assistantMessageEvent\":{},"
                    + "\"message\":{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":\"x\"}],"
                    + "\"timestamp\":99}}"));
            events.add(agent("{\"type\":\"turn_end\",\"stopReason\":\"toolUse\"}"));

            applyAll(events);
            var first = engine.snapshot();

            var second = new TurnProjectionEngine(null);
            events.forEach(second::apply);

            assertEquals(first.turns(), second.snapshot().turns());
            assertEquals(first.messages(), second.snapshot().messages());
            assertEquals(first, second.snapshot());
        }
    }

    // -- Turn boundary tests --------------------------------------------------

    @Nested
    @DisplayName("turn boundaries")
    class TurnBoundaryTests {

        @Test
        @DisplayName("turn_end with stopReason toolUse keeps the turn open; a plain turn_end closes it")
        void toolUseContinues() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"stopReason\":\"toolUse\"}"));

            assertEquals(1, engine.snapshot().activeTurnIndex());
            assertEquals(TurnStatus.RUNNING, engine.snapshot().turn(1).status());
            assertTrue(closedTurns.isEmpty());

            engine.apply(agent("{\"type\":\"turn_end\"}"));

            assertNull(engine.snapshot().activeTurnIndex());
            assertEquals(TurnStatus.COMPLETED, engine.snapshot().turn(1).status());
            assertEquals(1, engine.snapshot().turns().size());
            assertEquals(1, closedTurns.size());
        }

        @Test
        @DisplayName("stop reason on the embedded message also continues the turn")
        void messageStopReasonContinues() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"message\":{\"role\":\"assistant\","
                    + "\"stopReason\":\"tool_use\",\"content\":[]}}"));

            assertEquals(TurnStatus.RUNNING, engine.snapshot().turn(1).status());
        }

        @Test
        @DisplayName("pending tool-call requests on the terminating message continue the turn")
        void pendingToolCallsContinue() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"message\":{\"role\":\"assistant\",\"content\":["
                    + "{\"type\":\"toolCall\",\"id\":\"c1\",\"name\":\"read\"}]}}"));

            assertEquals(TurnStatus.RUNNING, engine.snapshot().turn(1).status());
            assertEquals(TurnProjectionEngine.STATUS_RESPONDING, engine.snapshot().agentStatus());
        }

        @Test
        @DisplayName("a second turn_start while a turn is running does not open another turn")
        void nestedTurnStartIsContinuation() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"stopReason\":\"toolUse\"}"));
            engine.apply(agent("{\"type\":\"turn_start\"}"));

            assertEquals(1, engine.snapshot().turns().size());
        }

        @Test
        @DisplayName("a message with no active turn opens one implicitly")
        void implicitOpen() {
            engine.apply(agent("{\"type\":\"message_start\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"x\",\"timestamp\":5}}"));

            var snapshot = engine.snapshot();
            assertEquals(1, snapshot.activeTurnIndex());
            assertEquals(1, snapshot.messages().get(0).turnIndex());
        }

        @Test
        @DisplayName("user message during an active turn is a steer")
        void steerStaysInTurn() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"user\",\"content\":\"first\","
                    + "\"timestamp\":1}}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"user\",\"content\":\"steer\","
                    + "\"timestamp\":2}}"));

            var snapshot = engine.snapshot();
            assertEquals(1, snapshot.turns().size());
            assertEquals(2, snapshot.messages().size());
            assertTrue(snapshot.messages().stream().allMatch(m -> m.turnIndex() == 1));
            assertEquals("user-1", snapshot.turn(1).userMessageId());
        }

        @Test
        @DisplayName("user message after a terminal turn opens the next turn")
        void followUpOpensNewTurn() {
            applyAll(endToEndScenario());
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"user\",\"content\":\"more\","
                    + "\"timestamp\":3}}"));

            var snapshot = engine.snapshot();
            assertEquals(2, snapshot.turns().size());
            assertEquals(2, snapshot.activeTurnIndex());
            assertEquals("user-3", snapshot.turn(2).userMessageId());
        }

        @Test
        @DisplayName("turn_interrupted force-closes the active turn as interrupted")
        void interruption() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"message_update\",\"text\":\"partial\"}"));
            engine.apply(daemon(TurnProjectionEngine.TURN_INTERRUPTED));

            var snapshot = engine.snapshot();
            assertEquals(TurnStatus.INTERRUPTED, snapshot.turn(1).status());
            assertNotNull(snapshot.turn(1).endedAt());
            assertNull(snapshot.activeTurnIndex());
            assertEquals(MessageStatus.COMPLETE, snapshot.messages().get(0).status());
            assertTrue(closedTurns.isEmpty(), "held back until the agent winds down");

            engine.apply(agent("{\"type\":\"agent_end\"}"));

            assertEquals(1, closedTurns.size());
            assertEquals(TurnStatus.INTERRUPTED, closedTurns.get(0).turn().status());
        }

        @Test
        @DisplayName("agent events after an abort belong to the interrupted turn")
        void lateEventsAfterAbort() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"user\",\"content\":\"do it\","
                    + "\"timestamp\":1}}"));
            engine.apply(agent("{\"type\":\"message_start\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"Working\",\"timestamp\":2}}"));
            engine.apply(daemon(TurnProjectionEngine.TURN_INTERRUPTED));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"Working on\",\"timestamp\":2,\"stopReason\":\"aborted\"}}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"stopReason\":\"aborted\"}"));
            engine.apply(agent("{\"type\":\"agent_end\"}"));

            var snapshot = engine.snapshot();
            assertEquals(1, snapshot.turns().size());
            var turn = snapshot.turn(1);
            assertEquals(TurnStatus.INTERRUPTED, turn.status());
            assertEquals("assistant-2", turn.finalAssistantMessageId());
            assertEquals("Working on", snapshot.message("assistant-2").text());
            assertEquals(1, snapshot.message("assistant-2").turnIndex());
            assertEquals(TurnProjectionEngine.STATUS_IDLE, snapshot.agentStatus());

            assertEquals(1, closedTurns.size());
            var closed = closedTurns.get(0);
            assertEquals(1, closed.index());
            assertEquals(List.of("turn_start", "message_end", "message_start", "message_end", "turn_end"),
                    closed.events().stream().map(SandboxEvent::type).toList());

            var rows = new TurnMessageConverter(MAPPER).convert(closed.events(), 0, closed.index()).messages();
            assertEquals(2, rows.size());
            assertEquals("assistant", rows.get(1).role());
            assertEquals("Working on", rows.get(1).content());
            assertEquals(1, rows.get(1).turnIndex());
        }

        @Test
        @DisplayName("late tool events after an abort update the interrupted turn")
        void lateToolEventsAfterAbort() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"tool_execution_start\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"));
            engine.apply(daemon(TurnProjectionEngine.TURN_INTERRUPTED));
            engine.apply(agent("{\"type\":\"tool_execution_end\",\"toolCallId\":\"t1\",\"isError\":true}"));
            engine.apply(agent("{\"type\":\"agent_end\"}"));

            var snapshot = engine.snapshot();
            assertEquals(1, snapshot.turns().size());
            assertEquals(ToolCallStatus.ERROR, snapshot.turn(1).toolCalls().get(0).status());
            assertEquals(1, closedTurns.size());
            assertEquals(4, closedTurns.get(0).events().size());
        }

        @Test
        @DisplayName("a new prompt after an abort releases the interrupted turn and opens the next one")
        void newPromptAfterAbort() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(daemon(TurnProjectionEngine.TURN_INTERRUPTED));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"user\",\"content\":\"again\","
                    + "\"timestamp\":5}}"));

            var snapshot = engine.snapshot();
            assertEquals(2, snapshot.turns().size());
            assertEquals(2, snapshot.activeTurnIndex());
            assertEquals(2, snapshot.message("user-5").turnIndex());
            assertEquals(1, closedTurns.size());
            assertEquals(1, closedTurns.get(0).index());
        }

        @Test
        @DisplayName("sandbox_terminated publishes the interrupted turn immediately")
        void terminationPublishesImmediately() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(daemon(TurnProjectionEngine.SANDBOX_TERMINATED));

            assertEquals(TurnStatus.INTERRUPTED, engine.snapshot().turn(1).status());
            assertEquals(1, closedTurns.size());
        }

        @Test
        @DisplayName("sandbox_terminated releases a turn still waiting for the agent")
        void terminationReleasesDrainingTurn() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(daemon(TurnProjectionEngine.TURN_INTERRUPTED));
            engine.apply(daemon(TurnProjectionEngine.SANDBOX_TERMINATED));

            assertEquals(1, closedTurns.size());
            assertEquals(TurnStatus.INTERRUPTED, closedTurns.get(0).turn().status());
        }

        @Test
        @DisplayName("interruption with no active turn changes nothing")
        void interruptionWithoutTurn() {
            engine.apply(daemon(TurnProjectionEngine.SANDBOX_TERMINATED));

            assertTrue(engine.snapshot().turns().isEmpty());
            assertTrue(closedTurns.isEmpty());
        }

        @Test
        @DisplayName("agent_end closes a still-running turn")
        void agentEndCloses() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"stopReason\":\"toolUse\"}"));
            engine.apply(agent("{\"type\":\"agent_end\"}"));

            assertEquals(TurnStatus.COMPLETED, engine.snapshot().turn(1).status());
            assertEquals(1, closedTurns.size());
        }

        @Test
        @DisplayName("endedAt comes from the event timestamp")
        void endedAtFromEvent() {
            engine.apply(agent("{\"type\":\"turn_start\",\"timestamp\":100}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"timestamp\":250}"));

            var turn = engine.snapshot().turn(1);
            assertEquals(100L, turn.startedAt());
            assertEquals(250L, turn.endedAt());
        }
    }

    // -- Message tests --------------------------------------------------------

    @Nested
    @DisplayName("messages")
    class MessageTests {

        @Test
        @DisplayName("cumulative deltas produce the final text exactly once")
        void cumulativeDeltas() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            for (String chunk : List.of("Hel", "Hello", "Hello wor", "Hello world")) {
                engine.apply(agent("{\"type\":\"message_update\",\"text\":\"" + chunk + "\"}"));
            }
            engine.apply(agent("{\"type\":\"message_end\"}"));

            var messages = engine.snapshot().messages();
            assertEquals(1, messages.size());
            assertEquals("Hello world", messages.get(0).text());
            assertEquals(MessageStatus.COMPLETE, messages.get(0).status());
        }

        @Test
        @DisplayName("incremental deltas are appended and stale deltas ignored")
        void incrementalDeltas() {
            engine.apply(agent("{\"type\":\"message_update\",\"delta\":\"Hello\"}"));
            engine.apply(agent("{\"type\":\"message_update\",\"delta\":\" world\"}"));
            engine.apply(agent("{\"type\":\"message_update\",\"delta\":\"Hello\"}"));

            var message = engine.snapshot().messages().get(0);
            assertEquals("Hello world", message.text());
            assertEquals("pi-msg-1-assistant", message.id());
            assertEquals(MessageStatus.STREAMING, message.status());
        }

        @Test
        @DisplayName("mergeText follows replace, keep and append rules")
        void mergeTextRules() {
            assertEquals("Hello", TurnProjectionEngine.mergeText("Hel", "Hello"));
            assertEquals("Hello", TurnProjectionEngine.mergeText("Hello", "Hel"));
            assertEquals("Hello world", TurnProjectionEngine.mergeText("Hello", " world"));
            assertEquals("abc", TurnProjectionEngine.mergeText("", "abc"));
            assertEquals("abc", TurnProjectionEngine.mergeText("abc", ""));
        }

        @Test
        @DisplayName("partials of a signed message are upserted in place")
        void signedMessageUpsert() {
            engine.apply(agent("{\"type\":\"message_start\",\"message\":{\"role\":\"assistant\","
                    + "\"textSignature\":\"sig-1\",\"content\":[{\"type\":\"text\",\"text\":\"He\"}]}}"));
            engine.apply(agent("{\"type\":\"message_update\",\"message\":{\"role\":\"assistant\","
                    + "\"textSignature\":\"sig-1\",\"content\":[{\"type\":\"text\",\"text\":\"Hello\"}]}}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"assistant\","
                    + "\"textSignature\":\"sig-1\",\"content\":[{\"type\":\"thinking\",\"thinking\":\"hmm\"},"
                    + "{\"type\":\"text\",\"text\":\"Hello!\"}]}}"));

            var messages = engine.snapshot().messages();
            assertEquals(1, messages.size());
            var message = messages.get(0);
            assertEquals("sig-1", message.id());
            assertEquals("Hello!", message.text());
            assertEquals("hmm", message.thinking());
            assertEquals(1L, message.cursor());
            assertEquals(MessageStatus.COMPLETE, message.status());
        }

        @Test
        @DisplayName("a completed message gets exactly one timeline entry")
        void singleMessageTrace() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"a\",\"timestamp\":7}}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"ab\",\"timestamp\":7}}"));

            var timeline = engine.snapshot().turn(1).timeline();
            assertEquals(1, timeline.size());
            assertEquals(TraceKind.MESSAGE, timeline.get(0).kind());
            assertEquals("ab", timeline.get(0).text());
        }

        @Test
        @DisplayName("late streaming update does not downgrade a complete message")
        void noDowngrade() {
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"final\",\"timestamp\":7}}"));
            engine.apply(agent("{\"type\":\"message_update\",\"message\":{\"role\":\"assistant\","
                    + "\"content\":\"fin\",\"timestamp\":7}}"));

            var message = engine.snapshot().message("assistant-7");
            assertEquals("final", message.text());
            assertEquals(MessageStatus.COMPLETE, message.status());
        }

        @Test
        @DisplayName("toolResult role maps to tool and tool-call requests are deduplicated")
        void rolesAndToolCalls() {
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"assistant\",\"timestamp\":1,"
                    + "\"content\":[{\"type\":\"toolCall\",\"id\":\"c1\",\"name\":\"bash\"},"
                    + "{\"type\":\"toolCall\",\"id\":\"c1\",\"name\":\"bash\"}]}}"));
            engine.apply(agent("{\"type\":\"message_end\",\"message\":{\"role\":\"toolResult\",\"timestamp\":2,"
                    + "\"content\":[{\"type\":\"text\",\"text\":\"ok\"}]}}"));

            var snapshot = engine.snapshot();
            assertEquals(1, snapshot.message("assistant-1").toolCalls().size());
            assertEquals(MessageRole.TOOL, snapshot.message("toolResult-2").role());
        }

        @Test
        @DisplayName("message_end with no text and no streaming message is ignored")
        void emptyEndIgnored() {
            engine.apply(agent("{\"type\":\"message_end\"}"));

            assertTrue(engine.snapshot().messages().isEmpty());
        }

        @Test
        @DisplayName("terminal turn_end flushes streaming messages and records the final assistant message")
        void turnEndFlushes() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"message_update\",\"text\":\"streamed\"}"));
            engine.apply(agent("{\"type\":\"turn_end\"}"));

            var snapshot = engine.snapshot();
            assertEquals(MessageStatus.COMPLETE, snapshot.messages().get(0).status());
            assertEquals("pi-msg-2-assistant", snapshot.turn(1).finalAssistantMessageId());
        }

        @Test
        @DisplayName("turn_end embedded message is upserted as complete")
        void turnEndMessage() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"turn_end\",\"message\":{\"role\":\"assistant\",\"content\":\"bye\","
                    + "\"timestamp\":42}}"));

            var snapshot = engine.snapshot();
            assertEquals(MessageStatus.COMPLETE, snapshot.message("assistant-42").status());
            assertEquals("assistant-42", snapshot.turn(1).finalAssistantMessageId());
        }
    }

    // -- Tool call tests ------------------------------------------------------

    @Nested
    @DisplayName("tool calls")
    class ToolCallTests {

        @Test
        @DisplayName("start, two updates and end yield one record and one trace entry")
        void singleRecordPerToolCall() {
            engine.apply(agent("{\"type\":\"tool_execution_start\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"));
            engine.apply(agent("{\"type\":\"tool_execution_update\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"));
            engine.apply(agent("{\"type\":\"tool_execution_update\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"));
            engine.apply(agent("{\"type\":\"tool_execution_end\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"));

            var turn = engine.snapshot().turn(1);
            assertEquals(1, turn.toolCalls().size());
            assertEquals(1, turn.timeline().size());
            var call = turn.toolCalls().get(0);
            assertEquals(ToolCallStatus.DONE, call.status());
            assertEquals(1001L, call.startedAt());
            assertEquals(1004L, call.endedAt());
            assertEquals(ToolCallStatus.DONE, turn.timeline().get(0).toolStatus());
        }

        @Test
        @DisplayName("isError marks the call as error and a later update never reverts it")
        void terminalStatusSticks() {
            engine.apply(agent("{\"type\":\"tool_execution_end\",\"toolCallId\":\"t1\",\"isError\":true}"));
            engine.apply(agent("{\"type\":\"tool_execution_update\",\"toolCallId\":\"t1\"}"));

            var call = engine.snapshot().turn(1).toolCalls().get(0);
            assertEquals(ToolCallStatus.ERROR, call.status());
            assertEquals(1001L, call.endedAt());
        }

        @Test
        @DisplayName("missing tool call id falls back to the cursor")
        void fallbackId() {
            engine.apply(agent("{\"type\":\"tool_execution_start\"}"));

            var call = engine.snapshot().turn(1).toolCalls().get(0);
            assertEquals("tool-1", call.id());
            assertEquals("tool", call.toolName());
        }

        @Test
        @DisplayName("agent status tracks the running tool")
        void agentStatus() {
            engine.apply(agent("{\"type\":\"tool_execution_start\",\"toolCallId\":\"t1\",\"toolName\":\"bash\"}"));
            assertEquals("Running bash", engine.snapshot().agentStatus());

            engine.apply(agent("{\"type\":\"tool_execution_end\",\"toolCallId\":\"t1\"}"));
            assertEquals(TurnProjectionEngine.STATUS_IDLE, engine.snapshot().agentStatus());
        }
    }

    // -- Robustness tests -----------------------------------------------------

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("unknown event types are kept in the raw turn events but not projected")
        void unknownEvents() {
            engine.apply(agent("{\"type\":\"turn_start\"}"));
            engine.apply(agent("{\"type\":\"something_new\",\"x\":1}"));
            engine.apply(agent("{\"type\":\"turn_end\"}"));

            var snapshot = engine.snapshot();
            assertTrue(snapshot.messages().isEmpty());
            assertTrue(snapshot.turn(1).timeline().isEmpty());
            assertEquals(3, closedTurns.get(0).events().size());
        }

        @Test
        @DisplayName("records at or below the last applied cursor are ignored")
        void duplicateCursorIgnored() {
            var start = agent("{\"type\":\"tool_execution_start\",\"toolCallId\":\"t1\"}");
            engine.apply(start);
            engine.apply(start);

            assertEquals(1, engine.snapshot().turn(1).toolCalls().size());
            assertEquals(1L, engine.snapshot().lastCursor());
        }

        @Test
        @DisplayName("a failing listener does not prevent other listeners")
        void failingListener() {
            List<ClosedTurn> second = new ArrayList<>();
            engine.addTurnClosedListener(t -> {
                throw new IllegalStateException("boom");
            });
            engine.addTurnClosedListener(second::add);

            applyAll(endToEndScenario());

            assertEquals(1, closedTurns.size());
            assertEquals(1, second.size());
        }

        @Test
        @DisplayName("reset clears all state")
        void reset() {
            applyAll(endToEndScenario());
            engine.reset();

            var snapshot = engine.snapshot();
            assertTrue(snapshot.turns().isEmpty());
            assertTrue(snapshot.messages().isEmpty());
            assertEquals(0L, snapshot.lastCursor());
        }
    }
}
