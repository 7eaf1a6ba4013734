package com.hivemind.core.model;

/**
 * Aggregate view of the orchestrator, always derived from current state.
 *
 * @param totalTasks        tasks ever submitted
 * @param completedTasks    tasks currently in COMPLETED
 * @param failedTasks       tasks currently in FAILED (requeued critical tasks are not counted)
 * @param averageTaskTime   mean actual duration of completed tasks, ms
 * @param systemLoad        fraction of agents that are busy or overloaded
 * @param agentUtilization  bound task slots over total task slots
 * @param networkEfficiency completed over total
 * @param queueLength       tasks waiting in the pending queue
 */
public record OrchestrationMetrics(
    int totalTasks,
    int completedTasks,
    int failedTasks,
    double averageTaskTime,
    double systemLoad,
    double agentUtilization,
    double networkEfficiency,
    int queueLength
) {

    public static final OrchestrationMetrics EMPTY = new OrchestrationMetrics(0, 0, 0, 0, 0, 0, 0, 0);
}
