package com.agentbox.core.events;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * An event together with the cursor the {@link EventLog} assigned to it.
 *
 * @param cursor position in the log, starting at 1
 * @param event  the immutable event
 */
public record EventRecord(long cursor, SandboxEvent event) {

    /** Stream envelope: {@code {"cursor":n,"event":{...}}}. */
    public ObjectNode toEnvelope() {
        ObjectNode envelope = JsonNodeFactory.instance.objectNode();
        envelope.put("cursor", cursor);
        envelope.set("event", event.toJson());
        return envelope;
    }
}
