package com.taskweave.core.engine;

import com.taskweave.core.TaskweaveException;

/**
 * Raised when a task names an agent that is not registered.
 */
public class AgentNotFoundException extends TaskweaveException {

    private final String agentId;

    public AgentNotFoundException(String agentId) {
        super("No agent registered under id: " + agentId);
        this.agentId = agentId;
    }

    public String getAgentId() {
        return agentId;
    }
}
