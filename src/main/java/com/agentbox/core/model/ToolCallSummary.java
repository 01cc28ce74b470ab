package com.agentbox.core.model;

/**
 * A tool-call request embedded in an assistant message.
 *
 * @param id   tool call id, or the tool name when the agent omitted an id
 * @param name tool name
 */
public record ToolCallSummary(String id, String name) {}
