package com.agentbox.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.Objects;

/**
 * An event observed by the daemon, either emitted by the agent process or by the
 * daemon itself (prompt queued, errors, lifecycle changes).
 * <p>
 * Agent events keep the raw protocol line as {@code payload}, with its {@code type}
 * normalized. Daemon events carry their fields ({@code error}, {@code detail},
 * {@code message}, ...) in {@code payload} and are rendered flat on the wire.
 *
 * @param source    daemon or agent
 * @param type      event type, e.g. "turn_start", "prompt_queued"
 * @param timestamp receipt time in epoch milliseconds
 * @param payload   event fields; never null
 */
public record SandboxEvent(
    EventSource source,
    String type,
    long timestamp,
    ObjectNode payload
) {

    public static final String UNKNOWN_TYPE = "unknown";

    public SandboxEvent {
        Objects.requireNonNull(source, "source");
        type = type == null || type.isBlank() ? UNKNOWN_TYPE : type;
        payload = payload != null ? payload : JsonNodeFactory.instance.objectNode();
    }

    /**
     * Wraps a parsed agent protocol line. A missing or non-string {@code type}
     * becomes {@value #UNKNOWN_TYPE}.
     */
    public static SandboxEvent agent(ObjectNode line, long timestamp) {
        ObjectNode payload = line.deepCopy();
        JsonNode rawType = payload.get("type");
        String type = rawType != null && rawType.isTextual() ? rawType.asText() : UNKNOWN_TYPE;
        payload.put("type", type);
        return new SandboxEvent(EventSource.AGENT, type, timestamp, payload);
    }

    public static SandboxEvent daemon(String type, long timestamp) {
        return new SandboxEvent(EventSource.DAEMON, type, timestamp, null);
    }

    public static SandboxEvent daemon(String type, long timestamp, Map<String, ?> fields) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        fields.forEach((key, value) -> {
            if (value instanceof JsonNode node) {
                payload.set(key, node);
            } else if (value != null) {
                payload.put(key, String.valueOf(value));
            }
        });
        return new SandboxEvent(EventSource.DAEMON, type, timestamp, payload);
    }

    public boolean isAgent() {
        return source == EventSource.AGENT;
    }

    /**
     * Resolves the agent event discriminator; daemon events are always {@link AgentEventType#UNKNOWN}.
     */
    public AgentEventType agentType() {
        if (!isAgent()) {
            return AgentEventType.UNKNOWN;
        }
        JsonNode payloadType = payload.get("type");
        return AgentEventType.fromWire(payloadType != null && payloadType.isTextual()
                ? payloadType.asText()
                : type);
    }

    public ObjectNode toJson() {
        ObjectNode json = JsonNodeFactory.instance.objectNode();
        json.put("source", source.wireName());
        json.put("type", type);
        json.put("timestamp", timestamp);
        if (isAgent()) {
            json.set("payload", payload);
        } else {
            payload.fields().forEachRemaining(field -> {
                if (!json.has(field.getKey())) {
                    json.set(field.getKey(), field.getValue());
                }
            });
        }
        return json;
    }
}
