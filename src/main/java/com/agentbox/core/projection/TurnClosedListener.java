package com.agentbox.core.projection;

import com.agentbox.core.model.ClosedTurn;

/**
 * Notified once for every turn that reaches a terminal status.
 */
@FunctionalInterface
public interface TurnClosedListener {

    void onTurnClosed(ClosedTurn closedTurn);
}
