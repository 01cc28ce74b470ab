package com.agentbox.core.persistence;

import com.agentbox.core.events.SandboxEvent;
import com.agentbox.core.model.PersistedMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts the raw agent events of one closed turn into persisted message rows.
 * <p>
 * {@code message_end} messages are preferred; when a turn has none, its
 * {@code message_start} messages are used instead. A turn with neither falls
 * back to the last {@code turn_end} message and its {@code toolResults}.
 */
public class TurnMessageConverter {

    private final ObjectMapper objectMapper;

    public TurnMessageConverter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Result of a conversion.
     *
     * @param messages   rows with cursors {@code start+1..start+n}
     * @param nextCursor {@code start+n}
     */
    public record Conversion(List<PersistedMessage> messages, long nextCursor) {}

    private record Row(String role, String content, String toolName, String toolCallId) {}

    public Conversion convert(List<SandboxEvent> events, long startCursor, int turnIndex) {
        List<Row> ended = new ArrayList<>();
        List<Row> started = new ArrayList<>();
        JsonNode turnEnd = null;

        for (SandboxEvent event : events) {
            JsonNode payload = event.payload();
            String type = textOrNull(payload, "type");
            if (type == null) {
                type = event.type();
            }
            if ("turn_end".equals(type)) {
                turnEnd = payload;
                continue;
            }
            if (!"message_end".equals(type) && !"message_start".equals(type)) {
                continue;
            }
            JsonNode message = payload.get("message");
            Row row = message != null && message.isObject() ? fromMessage(message) : fromFlatPayload(payload);
            if (row == null) {
                continue;
            }
            if ("message_end".equals(type)) {
                ended.add(row);
            } else {
                started.add(row);
            }
        }

        List<Row> selected = new ArrayList<>(!ended.isEmpty() ? ended : started);
        if (selected.isEmpty() && turnEnd != null) {
            JsonNode message = turnEnd.get("message");
            if (message != null && message.isObject()) {
                Row row = fromMessage(message);
                if (row != null) {
                    selected.add(row);
                }
            }
            JsonNode toolResults = turnEnd.get("toolResults");
            if (toolResults != null && toolResults.isArray()) {
                for (JsonNode item : toolResults) {
                    if (item.isObject()) {
                        Row row = fromMessage(item);
                        if (row != null) {
                            selected.add(row);
                        }
                    }
                }
            }
        }

        long base = Math.max(0, startCursor);
        List<PersistedMessage> messages = new ArrayList<>(selected.size());
        for (int i = 0; i < selected.size(); i++) {
            Row row = selected.get(i);
            messages.add(new PersistedMessage(base + i + 1, row.role(), row.content(), row.toolName(),
                    row.toolCallId(), turnIndex));
        }
        return new Conversion(List.copyOf(messages), base + messages.size());
    }

    /**
     * One JSON object per line, in event order, newline-terminated.
     */
    public String toNdjson(List<SandboxEvent> events) {
        StringBuilder ndjson = new StringBuilder();
        for (SandboxEvent event : events) {
            try {
                ndjson.append(objectMapper.writeValueAsString(event.toJson())).append('\n');
            } catch (JsonProcessingException e) {
                throw new PersistenceException("Failed to serialize " + event.type() + " event", e);
            }
        }
        return ndjson.toString();
    }

    private static Row fromMessage(JsonNode message) {
        String role = normalizeRole(textOrDefault(message, "role", "assistant"));
        if (role == null) {
            return null;
        }
        return new Row(role, contentText(message.get("content")),
                nonEmpty(textOrNull(message, "toolName")), nonEmpty(textOrNull(message, "toolCallId")));
    }

    private static Row fromFlatPayload(JsonNode payload) {
        String role = normalizeRole(textOrDefault(payload, "role", "assistant"));
        if (role == null) {
            return null;
        }
        String text = textOrNull(payload, "text");
        if (text == null) {
            text = textOrNull(payload, "delta");
        }
        if (text == null || text.isEmpty()) {
            return null;
        }
        return new Row(role, text, nonEmpty(textOrNull(payload, "toolName")),
                nonEmpty(textOrNull(payload, "toolCallId")));
    }

    static String contentText(JsonNode content) {
        if (content == null) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (!content.isArray()) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode item : content) {
            if (item.isObject() && "text".equals(textOrNull(item, "type"))) {
                String part = textOrNull(item, "text");
                if (part != null) {
                    text.append(part);
                }
            }
        }
        return text.toString();
    }

    private static String normalizeRole(String role) {
        return switch (role) {
            case "user" -> "user";
            case "assistant" -> "assistant";
            case "tool", "toolResult" -> "tool";
            default -> null;
        };
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }

    private static String textOrDefault(JsonNode node, String field, String fallback) {
        String value = textOrNull(node, field);
        return value != null ? value : fallback;
    }

    private static String nonEmpty(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
