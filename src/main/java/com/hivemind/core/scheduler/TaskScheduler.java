package com.hivemind.core.scheduler;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one scheduling pass for a task: filter candidates, score them, pick the best.
 * <p>
 * Ties on score go to the lexicographically lowest agent id. Binding the chosen
 * agent is left to the caller, which owns the state lock.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private static final Comparator<AgentScore> BEST_FIRST = Comparator
            .comparingDouble(AgentScore::total).reversed()
            .thenComparing(AgentScore::agentId);

    private final CandidateFilter filter;
    private final AgentScorer scorer;
    private final boolean enforceDependencies;

    public TaskScheduler(boolean enforceDependencies) {
        this(new CandidateFilter(), new AgentScorer(), enforceDependencies);
    }

    public TaskScheduler(CandidateFilter filter, AgentScorer scorer, boolean enforceDependencies) {
        this.filter = filter;
        this.scorer = scorer;
        this.enforceDependencies = enforceDependencies;
    }

    /**
     * @return the highest-scoring eligible agent, or empty when no agent qualifies
     */
    public Optional<Agent> selectAgent(Task task, Collection<Agent> agents) {
        List<Agent> candidates = filter.eligible(task, agents);
        if (candidates.isEmpty()) {
            log.debug("No candidate agent for {} (requires {} at level >= {})",
                    task.id(), task.requiredCapabilities(), task.complexity());
            return Optional.empty();
        }

        List<AgentScore> ranked = candidates.stream()
                .map(agent -> scorer.score(agent, task))
                .sorted(BEST_FIRST)
                .toList();
        if (log.isDebugEnabled()) {
            ranked.forEach(s -> log.debug("  {} score={} (cap={} perf={} load={} res={})",
                    s.agentId(), fmt(s.total()), fmt(s.capabilityMatch()), fmt(s.performance()),
                    fmt(s.loadInverse()), fmt(s.resourceHeadroom())));
        }

        String bestId = ranked.get(0).agentId();
        return candidates.stream().filter(a -> a.id().equals(bestId)).findFirst();
    }

    /**
     * Whether a task may leave PENDING. Always true unless dependency enforcement is on,
     * in which case every dependency id must name a COMPLETED task.
     */
    public boolean isReady(Task task, Map<String, Task> tasksById) {
        if (!enforceDependencies || task.dependencies().isEmpty()) {
            return true;
        }
        for (String dep : task.dependencies()) {
            Task dependency = tasksById.get(dep);
            if (dependency == null || dependency.status() != TaskStatus.COMPLETED) {
                log.debug("  {} waiting on dependency {}", task.id(), dep);
                return false;
            }
        }
        return true;
    }

    public boolean enforcesDependencies() {
        return enforceDependencies;
    }

    private static String fmt(double value) {
        return String.format("%.3f", value);
    }
}
