package com.agentbox.agent;

/**
 * Creates providers for {@link LazyAgentSupervisor}. A change in {@link #getRevision()}
 * means the current provider is stale and must be replaced.
 */
public interface AgentProviderFactory {

    AgentProvider create(long revision);

    long getRevision();
}
