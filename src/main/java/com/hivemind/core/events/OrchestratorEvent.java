package com.hivemind.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An orchestrator state change delivered to subscribers.
 * <p>
 * Payload values are detached snapshots: {@code "task"} holds a Task copy,
 * {@code "agents"} a list of Agent copies, {@code "agent"} an Agent copy and
 * {@code "metrics"} an OrchestrationMetrics.
 *
 * @param type      which state change occurred
 * @param taskId    the task involved (null for agent- and metrics-level events)
 * @param agentId   the agent involved, when there is a single one
 * @param payload   snapshot data for the event
 * @param timestamp when the event occurred
 */
public record OrchestratorEvent(
    EventType type,
    String taskId,
    String agentId,
    Map<String, Object> payload,
    Instant timestamp
) {

    @SuppressWarnings("unchecked")
    public <T> T payloadValue(String key) {
        return (T) payload.get(key);
    }
}
