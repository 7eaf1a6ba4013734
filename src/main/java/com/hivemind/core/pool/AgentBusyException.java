package com.hivemind.core.pool;

import java.util.Set;

/**
 * Thrown when removing an agent that still holds tasks; removal would orphan them.
 */
public class AgentBusyException extends AgentPoolException {

    private final String agentId;
    private final Set<String> activeTasks;

    public AgentBusyException(String agentId, Set<String> activeTasks) {
        super("Agent " + agentId + " cannot be removed while it holds " + activeTasks.size()
                + " task(s): " + activeTasks);
        this.agentId = agentId;
        this.activeTasks = Set.copyOf(activeTasks);
    }

    public String agentId() { return agentId; }
    public Set<String> activeTasks() { return activeTasks; }
}
