package com.postbox.exception;

/**
 * Exception thrown when an agent's worker failed with a checked exception.
 * Runtime failures are rethrown as they are; this type only wraps checked ones.
 */
public class AgentException extends RuntimeException {

    /** The name of the agent where the exception occurred. */
    private final String agentName;

    /**
     * Creates a new AgentException with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     */
    public AgentException(String message, Throwable cause) {
        super(message, cause);
        this.agentName = null;
    }

    /**
     * Creates a new AgentException with the specified detail message, cause, and agent name.
     *
     * @param message the detail message
     * @param cause the cause of the exception
     * @param agentName the name of the agent where the exception occurred
     */
    public AgentException(String message, Throwable cause, String agentName) {
        super(message, cause);
        this.agentName = agentName;
    }

    /**
     * Returns the name of the agent where the exception occurred.
     *
     * @return the agent name, or null if not specified
     */
    public String getAgentName() {
        return agentName;
    }
}
