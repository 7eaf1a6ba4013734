package com.hivemind.core.learning;

import com.hivemind.core.model.Adaptation;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentPerformance;
import com.hivemind.core.model.Capability;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskHistoryEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Adapts an agent after each settled task: nudges the levels of the capabilities the
 * task required and recomputes performance over a sliding window of recent outcomes.
 */
public class LearningController {

    private static final Logger log = LoggerFactory.getLogger(LearningController.class);

    private final double successDelta;
    private final double failureDelta;
    private final int performanceWindow;
    private final int logLimit;

    public LearningController(double successDelta, double failureDelta, int performanceWindow, int logLimit) {
        if (performanceWindow < 1) {
            throw new IllegalArgumentException("performanceWindow must be at least 1");
        }
        this.successDelta = successDelta;
        this.failureDelta = Math.abs(failureDelta);
        this.performanceWindow = performanceWindow;
        this.logLimit = logLimit;
    }

    /**
     * Records the outcome in the agent's history, then adapts capabilities and performance.
     *
     * @return adaptations that actually changed a level
     */
    public List<Adaptation> recordOutcome(Agent agent, Task task, long durationMs, boolean success, Instant now) {
        agent.appendHistory(new TaskHistoryEntry(task.type(), durationMs, success), logLimit);
        List<Adaptation> applied = adaptCapabilities(agent, task, success, now);
        recomputePerformance(agent);
        return applied;
    }

    List<Adaptation> adaptCapabilities(Agent agent, Task task, boolean success, Instant now) {
        double delta = success ? successDelta : -failureDelta;
        var applied = new ArrayList<Adaptation>();
        for (CapabilityType type : task.requiredCapabilities()) {
            Optional<Capability> capability = agent.capability(type);
            if (capability.isEmpty()) {
                continue;
            }
            Capability cap = capability.get();
            if (cap.adjustLevel(delta)) {
                var adaptation = new Adaptation(type, delta, cap.level(), now);
                agent.appendAdaptation(adaptation, logLimit);
                applied.add(adaptation);
                log.debug("Agent {} {} level -> {}", agent.id(), type.wireName(), String.format("%.3f", cap.level()));
            }
        }
        return applied;
    }

    /**
     * successRate and averageCompletionTime over the last window entries;
     * {@code efficiency = successRate / max(1, averageCompletionTime / 1000)}.
     */
    void recomputePerformance(Agent agent) {
        List<TaskHistoryEntry> recent = agent.recentHistory(performanceWindow);
        if (recent.isEmpty()) {
            return;
        }
        long successes = recent.stream().filter(TaskHistoryEntry::success).count();
        double successRate = (double) successes / recent.size();
        double averageTime = recent.stream().mapToLong(TaskHistoryEntry::durationMs).average().orElse(0.0);

        AgentPerformance performance = agent.performance();
        performance.setSuccessRate(successRate);
        performance.setAverageCompletionTime(averageTime);
        performance.setEfficiency(successRate * (1.0 / Math.max(1.0, averageTime / 1000.0)));
    }
}
