package com.agentbox.agent;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * Credentials pushed to the daemon by the control plane.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CredentialsPayload(String version, Llm llm, Github github, Extra extra) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Llm(String anthropicApiKey, String openaiApiKey) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Github(String token, String username, String email) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Extra(Map<String, String> env) {}
}
