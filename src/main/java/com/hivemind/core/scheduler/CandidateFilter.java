package com.hivemind.core.scheduler;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Decides which agents may take a task: capability levels, availability and
 * resource headroom must all hold.
 */
public class CandidateFilter {

    private static final Logger log = LoggerFactory.getLogger(CandidateFilter.class);

    /** Resource demand per complexity point, applied to cpu and memory. */
    static final double RESOURCE_PER_COMPLEXITY = 0.1;
    /** cpu/memory after adding the demand must stay strictly below this. */
    static final double RESOURCE_CEILING = 0.9;

    public List<Agent> eligible(Task task, Collection<Agent> agents) {
        return agents.stream().filter(agent -> isEligible(agent, task)).toList();
    }

    public boolean isEligible(Agent agent, Task task) {
        boolean capable = hasCapabilities(agent, task);
        boolean available = isAvailable(agent);
        boolean headroom = hasHeadroom(agent, task);
        if (log.isDebugEnabled()) {
            log.debug("  {} for {}: capable={} available={} headroom={}",
                    agent.id(), task.id(), capable, available, headroom);
        }
        return capable && available && headroom;
    }

    /** Every required type present at a level of at least the task's complexity. */
    boolean hasCapabilities(Agent agent, Task task) {
        for (CapabilityType required : task.requiredCapabilities()) {
            boolean met = agent.capabilities().stream()
                    .anyMatch(c -> c.type() == required && c.level() >= task.complexity());
            if (!met) {
                return false;
            }
        }
        return true;
    }

    boolean isAvailable(Agent agent) {
        return agent.status() == AgentStatus.IDLE
                || (agent.status() == AgentStatus.BUSY && agent.hasCapacity());
    }

    boolean hasHeadroom(Agent agent, Task task) {
        double demand = task.complexity() * RESOURCE_PER_COMPLEXITY;
        return agent.resources().cpu() + demand < RESOURCE_CEILING
                && agent.resources().memory() + demand < RESOURCE_CEILING;
    }
}
