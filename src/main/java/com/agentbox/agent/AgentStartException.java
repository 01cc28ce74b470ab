package com.agentbox.agent;

/**
 * The agent subprocess could not be started within the configured number of attempts.
 */
public class AgentStartException extends RuntimeException {

    private final int attempts;

    public AgentStartException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
