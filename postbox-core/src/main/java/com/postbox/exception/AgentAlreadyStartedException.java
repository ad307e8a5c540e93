package com.postbox.exception;

/**
 * Thrown when {@code start()} is called on an agent that is already running.
 * The agent's state is left unchanged.
 */
public class AgentAlreadyStartedException extends IllegalStateException {

    private final String agentName;

    public AgentAlreadyStartedException(String agentName) {
        super("Agent " + agentName + " already started");
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
