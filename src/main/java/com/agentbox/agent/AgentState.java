package com.agentbox.agent;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Session details reported by the agent in reply to {@code get_state}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentState(String sessionFile, String sessionId) {}
