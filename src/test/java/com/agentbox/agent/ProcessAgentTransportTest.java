package com.agentbox.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ProcessAgentTransportTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ProcessAgentTransport transport;

    @AfterEach
    void tearDown() {
        if (transport != null) {
            transport.stop();
        }
    }

    private ProcessAgentTransport transport(List<String> command, Duration timeout) {
        transport = new ProcessAgentTransport(command, null, Map.of(), timeout, MAPPER);
        return transport;
    }

    private static ObjectNode command(String type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        return node;
    }

    // -- Line handling tests --------------------------------------------------

    @Nested
    @DisplayName("line handling")
    class LineHandlingTests {

        @Test
        @DisplayName("event lines reach every handler; blank, malformed and non-object lines are dropped")
        void dispatchesEventLines() {
            var t = transport(List.of("true"), Duration.ofSeconds(1));
            List<ObjectNode> first = new CopyOnWriteArrayList<>();
            List<ObjectNode> second = new CopyOnWriteArrayList<>();
            t.onLine(first::add);
            t.onLine(second::add);

            t.handleLine("   ");
            t.handleLine("{not json");
            t.handleLine("[1,2]");
            t.handleLine("  {\"type\":\"turn_start\"}  ");

            assertEquals(1, first.size());
            assertEquals(1, second.size());
            assertEquals("turn_start", first.get(0).get("type").asText());
        }

        @Test
        @DisplayName("lines without a string type are normalized to unknown")
        void normalizesType() {
            var t = transport(List.of("true"), Duration.ofSeconds(1));
            List<ObjectNode> lines = new CopyOnWriteArrayList<>();
            t.onLine(lines::add);

            t.handleLine("{\"foo\":1}");

            assertEquals("unknown", lines.get(0).get("type").asText());
        }

        @Test
        @DisplayName("unsubscribed handler no longer receives lines")
        void unsubscribe() {
            var t = transport(List.of("true"), Duration.ofSeconds(1));
            List<ObjectNode> lines = new CopyOnWriteArrayList<>();
            var subscription = t.onLine(lines::add);

            subscription.unsubscribe();
            t.handleLine("{\"type\":\"turn_start\"}");

            assertTrue(lines.isEmpty());
        }

        @Test
        @DisplayName("unmatched responses are ignored and not forwarded")
        void unmatchedResponse() {
            var t = transport(List.of("true"), Duration.ofSeconds(1));
            List<ObjectNode> lines = new CopyOnWriteArrayList<>();
            t.onLine(lines::add);

            t.handleLine("{\"type\":\"response\",\"id\":\"req-99\",\"success\":true}");

            assertTrue(lines.isEmpty());
        }
    }

    // -- Process tests --------------------------------------------------------

    @Nested
    @DisplayName("process")
    @EnabledOnOs({OS.LINUX, OS.MAC})
    class ProcessTests {

        @Test
        @DisplayName("send before start fails")
        void sendBeforeStart() {
            var t = transport(List.of("cat"), Duration.ofSeconds(1));

            var error = assertThrows(AgentTransportException.class, () -> t.send(command("abort")));
            assertEquals("transport not started", error.getMessage());
        }

        @Test
        @DisplayName("written commands round-trip through the subprocess")
        void roundTripThroughCat() throws Exception {
            var t = transport(List.of("cat"), Duration.ofSeconds(1));
            CountDownLatch latch = new CountDownLatch(1);
            List<ObjectNode> lines = new CopyOnWriteArrayList<>();
            t.onLine(line -> {
                lines.add(line);
                latch.countDown();
            });

            t.start();
            t.start();
            assertTrue(t.isRunning());
            t.send(command("turn_start"));

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals("turn_start", lines.get(0).get("type").asText());
        }

        @Test
        @DisplayName("a matching response completes the pending request with its data")
        void correlatesResponse() throws Exception {
            var t = transport(List.of("cat"), Duration.ofSeconds(5));
            t.start();

            var future = t.sendCommand(command("get_state"));
            t.handleLine("{\"type\":\"response\",\"id\":\"req-1\",\"success\":true,\"data\":{\"sessionId\":\"s1\"}}");

            assertEquals("s1", future.get(1, TimeUnit.SECONDS).get("sessionId").asText());
            assertEquals(0, t.pendingCount());
        }

        @Test
        @DisplayName("a failed response rejects with the error text")
        void rejectsFailedResponse() {
            var t = transport(List.of("cat"), Duration.ofSeconds(5));
            t.start();

            var future = t.sendCommand(command("get_state"));
            t.handleLine("{\"type\":\"response\",\"id\":\"req-1\",\"success\":false,\"error\":\"nope\"}");

            var error = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
            assertEquals("nope", error.getCause().getMessage());
        }

        @Test
        @DisplayName("unanswered requests time out and are removed")
        void timesOut() {
            var t = transport(List.of("cat"), Duration.ofMillis(100));
            t.start();

            var future = t.sendCommand(command("get_state"));

            var error = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
            assertTrue(error.getCause().getMessage().contains("timed out"));
            assertEquals(0, t.pendingCount());
        }

        @Test
        @DisplayName("stop rejects all pending requests and stops the process")
        void stopRejectsPending() {
            var t = transport(List.of("cat"), Duration.ofSeconds(30));
            t.start();
            var first = t.sendCommand(command("get_state"));
            var second = t.sendCommand(command("get_state"));

            t.stop();

            var error = assertThrows(ExecutionException.class, () -> first.get(1, TimeUnit.SECONDS));
            assertEquals("transport stopped", error.getCause().getMessage());
            assertTrue(second.isCompletedExceptionally());
            assertFalse(t.isRunning());
            assertThrows(AgentTransportException.class, () -> t.send(command("abort")));
        }

        @Test
        @DisplayName("environment overrides reach the subprocess")
        void passesEnvironment() throws Exception {
            transport = new ProcessAgentTransport(
                    List.of("sh", "-c", "printf '{\"type\":\"env\",\"value\":\"%s\"}\\n' \"$AGENT_TEST_VALUE\""),
                    null, Map.of("AGENT_TEST_VALUE", "hello"), Duration.ofSeconds(1), MAPPER);
            CountDownLatch latch = new CountDownLatch(1);
            List<ObjectNode> lines = new CopyOnWriteArrayList<>();
            transport.onLine(line -> {
                lines.add(line);
                latch.countDown();
            });

            transport.start();

            assertTrue(latch.await(5, TimeUnit.SECONDS));
            assertEquals("hello", lines.get(0).get("value").asText());
        }
    }

    @Test
    @DisplayName("empty command is rejected")
    void emptyCommand() {
        assertThrows(IllegalArgumentException.class,
                () -> new ProcessAgentTransport(List.of(), null, Map.of(), null, MAPPER));
    }
}
