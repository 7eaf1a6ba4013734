package com.hivemind.core.metrics;

import com.hivemind.core.model.OrchestrationMetrics;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.pool.AgentPool;
import com.hivemind.core.registry.TaskRegistry;

/**
 * Derives {@link OrchestrationMetrics} from the current pool and registry state.
 * Pure function of that state: two calls with no change in between return equal values.
 */
public class MetricsCalculator {

    public OrchestrationMetrics compute(AgentPool pool, TaskRegistry registry) {
        int total = registry.size();
        int completed = 0;
        int failed = 0;
        long completedDuration = 0;
        for (Task task : registry.list()) {
            if (task.status() == TaskStatus.COMPLETED) {
                completed++;
                completedDuration += task.actualDuration() != null ? task.actualDuration() : 0L;
            } else if (task.status() == TaskStatus.FAILED) {
                failed++;
            }
        }

        double averageTaskTime = completed > 0 ? (double) completedDuration / completed : 0.0;
        int totalCapacity = pool.totalCapacity();
        double utilization = totalCapacity > 0 ? (double) pool.usedCapacity() / totalCapacity : 0.0;
        double networkEfficiency = total > 0 ? (double) completed / total : 0.0;

        return new OrchestrationMetrics(total, completed, failed, averageTaskTime, pool.systemLoad(),
                utilization, networkEfficiency, registry.queueLength());
    }
}
