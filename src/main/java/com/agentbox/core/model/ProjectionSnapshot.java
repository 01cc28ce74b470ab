package com.agentbox.core.model;

import java.util.List;

/**
 * Immutable copy of the turn projection at a point in the event stream.
 *
 * @param turns           all turns, ordered by index
 * @param messages        all messages, in first-seen order
 * @param activeTurnIndex the running turn, or null
 * @param agentStatus     "Idle", "Responding" or "Running &lt;tool&gt;"
 * @param lastCursor      cursor of the last event applied
 */
public record ProjectionSnapshot(
    List<Turn> turns,
    List<Message> messages,
    Integer activeTurnIndex,
    String agentStatus,
    long lastCursor
) {

    public ProjectionSnapshot {
        turns = List.copyOf(turns);
        messages = List.copyOf(messages);
    }

    public Turn turn(int index) {
        return turns.stream().filter(t -> t.index() == index).findFirst().orElse(null);
    }

    public Message message(String id) {
        return messages.stream().filter(m -> m.id().equals(id)).findFirst().orElse(null);
    }
}
