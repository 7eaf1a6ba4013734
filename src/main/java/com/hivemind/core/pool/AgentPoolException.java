package com.hivemind.core.pool;

/**
 * Thrown when an agent pool operation would violate a pool invariant.
 */
public class AgentPoolException extends RuntimeException {
    public AgentPoolException(String message) {
        super(message);
    }

    public AgentPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
