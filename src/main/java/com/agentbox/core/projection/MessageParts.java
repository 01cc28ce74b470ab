package com.agentbox.core.projection;

import com.agentbox.core.model.MessageRole;
import com.agentbox.core.model.ToolCallSummary;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fields extracted from an agent {@code message} object.
 * <p>
 * Text comes from a {@code text} field, a string {@code content}, or the
 * {@code text} parts of a {@code content} array. Thinking and tool-call requests
 * are read from the corresponding content parts; tool calls are deduplicated by id.
 */
public record MessageParts(
    String rawRole,
    MessageRole role,
    String text,
    String thinking,
    List<ToolCallSummary> toolCalls,
    Long timestamp,
    String signature,
    String stopReason
) {

    public static MessageParts from(JsonNode message) {
        String rawRole = textOrNull(message, "role");
        if (rawRole == null) {
            rawRole = "assistant";
        }

        StringBuilder text = new StringBuilder();
        StringBuilder thinking = new StringBuilder();
        List<ToolCallSummary> unnamed = new ArrayList<>();
        Map<String, ToolCallSummary> byId = new LinkedHashMap<>();

        String directText = textOrNull(message, "text");
        if (directText != null) {
            text.append(directText);
        }
        String directThinking = textOrNull(message, "thinking");
        if (directThinking != null) {
            thinking.append(directThinking);
        }

        JsonNode content = message.get("content");
        if (content != null && content.isTextual()) {
            text.append(content.asText());
        } else if (content != null && content.isArray()) {
            for (JsonNode part : content) {
                if (!part.isObject()) {
                    continue;
                }
                String partType = textOrNull(part, "type");
                if ("text".equals(partType)) {
                    String partText = textOrNull(part, "text");
                    if (partText != null) {
                        text.append(partText);
                    }
                } else if ("thinking".equals(partType)) {
                    String partThinking = textOrNull(part, "thinking");
                    if (partThinking != null) {
                        thinking.append(partThinking);
                    }
                } else if ("toolCall".equals(partType)) {
                    String id = textOrNull(part, "id");
                    String name = textOrNull(part, "name");
                    ToolCallSummary call = new ToolCallSummary(id != null ? id : (name != null ? name : "tool"),
                            name != null ? name : "tool");
                    if (id != null) {
                        byId.put(id, call);
                    } else {
                        unnamed.add(call);
                    }
                }
            }
        }

        List<ToolCallSummary> toolCalls = new ArrayList<>(unnamed);
        toolCalls.addAll(byId.values());

        JsonNode ts = message.get("timestamp");
        Long timestamp = ts != null && ts.isNumber() ? ts.asLong() : null;

        String signature = textOrNull(message, "textSignature");
        if (signature == null || signature.isEmpty()) {
            signature = textOrNull(message, "thinkingSignature");
        }
        if (signature != null && signature.isEmpty()) {
            signature = null;
        }

        return new MessageParts(rawRole, MessageRole.fromWire(rawRole), text.toString(), thinking.toString(),
                toolCalls, timestamp, signature, textOrNull(message, "stopReason"));
    }

    /**
     * Identity of the message: its signature, else {@code <role>-<timestamp>},
     * else {@code msg-<cursor>-<role>}.
     */
    public String identity(long cursor) {
        if (signature != null) {
            return signature;
        }
        if (timestamp != null) {
            return rawRole + "-" + timestamp;
        }
        return "msg-" + cursor + "-" + rawRole;
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
