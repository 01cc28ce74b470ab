package com.agentbox.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A message row written to the state endpoint.
 *
 * @param cursor     persistence cursor, continuing from the saved checkpoint
 * @param role       "user", "assistant" or "tool"
 * @param content    concatenated text content
 * @param toolName   tool name for tool results
 * @param toolCallId tool call id for tool results
 * @param turnIndex  turn the message belongs to
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PersistedMessage(
    long cursor,
    String role,
    String content,
    String toolName,
    String toolCallId,
    int turnIndex
) {}
