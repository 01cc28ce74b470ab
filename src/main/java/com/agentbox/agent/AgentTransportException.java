package com.agentbox.agent;

/**
 * Failure talking to the agent subprocess: not started, write failed, request
 * rejected or timed out.
 */
public class AgentTransportException extends RuntimeException {

    public AgentTransportException(String message) {
        super(message);
    }

    public AgentTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
