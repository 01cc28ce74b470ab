package com.agentbox.agent;

import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.events.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Drives an agent that speaks the RPC protocol over an {@link AgentTransport}.
 * Every non-response line becomes an agent {@link SandboxEvent} stamped on receipt.
 */
public class RpcAgentProvider implements AgentProvider {

    private static final Logger log = LoggerFactory.getLogger(RpcAgentProvider.class);

    private final AgentTransport transport;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final List<Consumer<SandboxEvent>> handlers = new CopyOnWriteArrayList<>();

    private Subscription lineSubscription;

    public RpcAgentProvider(AgentTransport transport, ObjectMapper objectMapper) {
        this(transport, objectMapper, Clock.systemUTC());
    }

    RpcAgentProvider(AgentTransport transport, ObjectMapper objectMapper, Clock clock) {
        this.transport = transport;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public synchronized void start() {
        if (lineSubscription == null) {
            lineSubscription = transport.onLine(this::handleLine);
        }
        transport.start();
    }

    @Override
    public synchronized void stop() {
        if (lineSubscription != null) {
            lineSubscription.unsubscribe();
            lineSubscription = null;
        }
        transport.stop();
        handlers.clear();
    }

    @Override
    public void sendPrompt(PromptRequest request) {
        ObjectNode command = objectMapper.createObjectNode();
        command.put("type", "prompt");
        command.put("message", request.message());
        if (request.images() != null && !request.images().isNull()) {
            command.set("images", request.images());
        }
        if (request.streamingBehavior() != null) {
            command.put("streamingBehavior", request.streamingBehavior());
        }
        transport.send(command);
    }

    @Override
    public void abort(AbortRequest request) {
        ObjectNode command = objectMapper.createObjectNode();
        command.put("type", "abort");
        transport.send(command);
    }

    @Override
    public Subscription onEvent(Consumer<SandboxEvent> handler) {
        handlers.add(handler);
        return () -> handlers.remove(handler);
    }

    @Override
    public Optional<AgentState> getState() {
        if (!transport.isRunning()) {
            return Optional.empty();
        }
        ObjectNode command = objectMapper.createObjectNode();
        command.put("type", "get_state");
        try {
            JsonNode data = transport.sendCommand(command).join();
            if (data == null || !data.isObject()) {
                return Optional.empty();
            }
            return Optional.of(new AgentState(textOrNull(data, "sessionFile"), textOrNull(data, "sessionId")));
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.debug("get_state failed: {}", cause.getMessage());
            return Optional.empty();
        }
    }

    private void handleLine(ObjectNode line) {
        SandboxEvent event = SandboxEvent.agent(line, clock.millis());
        for (Consumer<SandboxEvent> handler : handlers) {
            handler.accept(event);
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
