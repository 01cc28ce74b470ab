package com.agentbox.agent;

import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.events.Subscription;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Abstraction over a running coding agent.
 * Implementations: {@link RpcAgentProvider} (one subprocess), {@link LazyAgentSupervisor}
 * (recreates the provider when its inputs change).
 */
public interface AgentProvider {

    void start();

    void stop();

    void sendPrompt(PromptRequest request);

    void abort(AbortRequest request);

    /**
     * Registers a handler for agent events.
     * @return handle that removes the handler
     */
    Subscription onEvent(Consumer<SandboxEvent> handler);

    /**
     * Queries session state. Empty when the agent is not running or does not answer.
     */
    default Optional<AgentState> getState() {
        return Optional.empty();
    }
}
