package com.hivemind.core.scheduler;

/**
 * Per-factor breakdown of how well an agent fits a task. Every factor is in [0, 1].
 */
public record AgentScore(
    String agentId,
    double capabilityMatch,
    double performance,
    double loadInverse,
    double resourceHeadroom,
    double total
) {
}
