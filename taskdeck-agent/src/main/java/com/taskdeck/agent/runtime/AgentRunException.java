package com.taskdeck.agent.runtime;

/**
 * The model runtime failed while driving an agent run.
 */
public class AgentRunException extends RuntimeException {

    public AgentRunException(String message) {
        super(message);
    }

    public AgentRunException(String message, Throwable cause) {
        super(message, cause);
    }
}
