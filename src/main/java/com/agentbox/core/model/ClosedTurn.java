package com.agentbox.core.model;

import com.agentbox.core.events.SandboxEvent;

import java.util.List;

/**
 * A turn that reached a terminal status, with the raw agent events recorded while it ran.
 */
public record ClosedTurn(Turn turn, List<SandboxEvent> events) {

    public ClosedTurn {
        events = List.copyOf(events);
    }

    public int index() {
        return turn.index();
    }
}
