package com.hivemind.core.scheduler;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Capability;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;

/**
 * Weighted multi-factor score:
 * {@code 0.4*capabilityMatch + 0.3*performance + 0.2*loadInverse + 0.1*resourceHeadroom}.
 */
public class AgentScorer {

    static final double CAPABILITY_WEIGHT = 0.4;
    static final double PERFORMANCE_WEIGHT = 0.3;
    static final double LOAD_WEIGHT = 0.2;
    static final double RESOURCE_WEIGHT = 0.1;

    public AgentScore score(Agent agent, Task task) {
        double capabilityMatch = capabilityMatch(agent, task);
        double performance = (agent.performance().successRate() + agent.performance().efficiency()) / 2.0;
        double loadInverse = 1.0 - (double) agent.currentTasks().size() / agent.maxConcurrentTasks();
        double resourceHeadroom = 1.0 - agent.resources().peak();

        double total = CAPABILITY_WEIGHT * capabilityMatch
                + PERFORMANCE_WEIGHT * performance
                + LOAD_WEIGHT * loadInverse
                + RESOURCE_WEIGHT * resourceHeadroom;
        return new AgentScore(agent.id(), capabilityMatch, performance, loadInverse, resourceHeadroom, total);
    }

    /** Mean of {@code level / 10} over the required capabilities; a missing one counts as 0. */
    private double capabilityMatch(Agent agent, Task task) {
        double sum = 0.0;
        for (CapabilityType required : task.requiredCapabilities()) {
            sum += agent.capability(required).map(Capability::level).orElse(0.0) / Capability.MAX_LEVEL;
        }
        return sum / task.requiredCapabilities().size();
    }
}
