package com.agentbox.core.events;

/**
 * Handle for cancelling a listener registration. Calling {@link #unsubscribe()}
 * more than once has no further effect.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
