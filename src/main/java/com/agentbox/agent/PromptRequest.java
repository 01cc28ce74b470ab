package com.agentbox.agent;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A prompt for the agent.
 *
 * @param message           the user's text
 * @param images            optional image attachments, passed through unchanged
 * @param streamingBehavior "steer" or "followUp" when the agent is already working
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PromptRequest(String message, JsonNode images, String streamingBehavior) {

    public static final String STEER = "steer";
    public static final String FOLLOW_UP = "followUp";

    public PromptRequest(String message) {
        this(message, null, null);
    }

    public boolean isValid() {
        if (message == null || message.isBlank()) {
            return false;
        }
        return streamingBehavior == null || STEER.equals(streamingBehavior) || FOLLOW_UP.equals(streamingBehavior);
    }
}
