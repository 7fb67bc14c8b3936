package com.roundabout.core.agent;

import com.roundabout.core.RoundaboutException;

/**
 * Raised when work is requested from an agent that has halted or been terminated.
 */
public class AgentHaltedException extends RoundaboutException {

    private final String agentId;

    public AgentHaltedException(String agentId, String message) {
        super(message);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
