package com.hivemind.core.pool;

public class UnknownAgentException extends AgentPoolException {
    public UnknownAgentException(String agentId) {
        super("No agent with id " + agentId);
    }
}
