package com.hivemind.core.pool;

public class DuplicateAgentException extends AgentPoolException {
    public DuplicateAgentException(String agentId) {
        super("An agent with id " + agentId + " is already registered");
    }
}
