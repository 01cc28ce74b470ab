package com.agentbox.daemon;

import com.agentbox.agent.PromptRequest;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Sandbox initialisation sent once by the control plane.
 *
 * @param sandboxId  sandbox the daemon persists to
 * @param coreApiUrl core API base URL; persistence is configured only when both are present
 * @param workspace  working directory for the agent, optional
 * @param prompt     first prompt to send once initialised, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InitRequest(String sandboxId, String coreApiUrl, String workspace, PromptRequest prompt) {}
