package com.agentbox.agent;

import com.agentbox.core.events.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Newline-delimited JSON channel to an agent process.
 */
public interface AgentTransport {

    void start();

    /**
     * Writes one command line. Fire-and-forget.
     *
     * @throws AgentTransportException if the transport is not started or the write fails
     */
    void send(ObjectNode command);

    /**
     * Writes a command with a fresh {@code id} and completes with the {@code data}
     * of the matching response, or exceptionally on rejection, timeout or stop.
     */
    CompletableFuture<JsonNode> sendCommand(ObjectNode command);

    /**
     * Registers a handler for every non-response line, already parsed.
     */
    Subscription onLine(Consumer<ObjectNode> handler);

    void stop();

    boolean isRunning();
}
