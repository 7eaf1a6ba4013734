package com.hivemind.core.execution;

import com.hivemind.core.learning.LearningController;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.model.Adaptation;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.pool.AgentPool;
import com.hivemind.core.registry.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts bound tasks through the {@link TaskDispatcher} and applies their outcomes.
 * <p>
 * {@link #start(Task)} and {@link #settle(Task, DispatchResult)} must be called under
 * the orchestrator's state lock. The future returned by {@code start} never completes
 * exceptionally: dispatcher errors and watchdog timeouts become failed results.
 * <p>
 * Durations are in task milliseconds. The optional watchdog converts its limit to wall time
 * with {@code timeScale} and is inactive when {@code timeScale} is 0.
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final AgentPool agentPool;
    private final TaskRegistry taskRegistry;
    private final LearningController learningController;
    private final TaskDispatcher dispatcher;
    private final Clock clock;
    private final int maxCriticalRetries;
    private final double watchdogMultiplier;
    private final long msPerComplexity;
    private final long jitterMs;
    private final double timeScale;

    public ExecutionEngine(AgentPool agentPool, TaskRegistry taskRegistry, LearningController learningController,
                           TaskDispatcher dispatcher, Clock clock, int maxCriticalRetries,
                           double watchdogMultiplier, long msPerComplexity, long jitterMs, double timeScale) {
        if (timeScale < 0) {
            throw new IllegalArgumentException("timeScale must not be negative");
        }
        this.agentPool = agentPool;
        this.taskRegistry = taskRegistry;
        this.learningController = learningController;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.maxCriticalRetries = maxCriticalRetries;
        this.watchdogMultiplier = watchdogMultiplier;
        this.msPerComplexity = msPerComplexity;
        this.jitterMs = jitterMs;
        this.timeScale = timeScale;
    }

    /**
     * Moves an ASSIGNED task to PROCESSING and dispatches it.
     */
    public CompletableFuture<DispatchResult> start(Task task) {
        task.markProcessing();
        Instant startedAt = clock.instant();

        List<Agent> agents = new ArrayList<>();
        for (String agentId : task.assignedAgents()) {
            agentPool.get(agentId).ifPresent(agent -> agents.add(agent.copy()));
        }
        log.info("Dispatching task {} to {}", task.id(), task.assignedAgents());

        CompletableFuture<DispatchResult> dispatched;
        try {
            dispatched = dispatcher.dispatch(task.copy(), List.copyOf(agents));
            if (dispatched == null) {
                throw new IllegalStateException("dispatcher returned no future");
            }
        } catch (RuntimeException e) {
            log.warn("Dispatcher rejected task {}: {}", task.id(), e.getMessage(), e);
            dispatched = CompletableFuture.failedFuture(e);
        }

        if (watchdogMultiplier > 0 && timeScale > 0) {
            long limitMs = Math.max(1L, Math.round(estimateDuration(task) * watchdogMultiplier * timeScale));
            dispatched = dispatched.orTimeout(limitMs, TimeUnit.MILLISECONDS);
        }

        return dispatched.exceptionally(error -> {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            long elapsed = toTaskMillis(Duration.between(startedAt, clock.instant()).toMillis());
            if (cause instanceof TimeoutException) {
                log.warn("Task {} exceeded its watchdog limit after {}ms", task.id(), elapsed);
                return DispatchResult.failure(elapsed, "watchdog timeout");
            }
            log.warn("Dispatch of task {} failed: {}", task.id(), cause.getMessage());
            return DispatchResult.failure(elapsed, "dispatch error: " + cause.getMessage());
        });
    }

    /**
     * Worst-case execution time in task milliseconds: {@code complexity * msPerComplexity + jitterMs},
     * or the submitter's estimate when that is larger. A low estimate never shortens the limit.
     */
    public long estimateDuration(Task task) {
        long worstCase = task.complexity() * msPerComplexity + jitterMs;
        return Math.max(worstCase, task.estimatedDuration());
    }

    /** Wall-clock milliseconds converted to task milliseconds, the unit durations are recorded in. */
    private long toTaskMillis(long wallMs) {
        return timeScale > 0 ? Math.round(wallMs / timeScale) : wallMs;
    }

    /**
     * Applies a dispatch outcome to a PROCESSING task and its agents. A failed critical
     * task with retries left is reset to PENDING and placed at the front of the queue.
     */
    public Settlement settle(Task task, DispatchResult result) {
        Instant now = clock.instant();
        long duration = result.durationMs();
        if (result.success()) {
            task.markCompleted(duration);
        } else {
            task.markFailed(duration);
        }

        List<String> agentIds = List.copyOf(task.assignedAgents());
        var adaptations = new ArrayList<Adaptation>();
        for (String agentId : agentIds) {
            var maybeAgent = agentPool.get(agentId);
            if (maybeAgent.isEmpty()) {
                log.warn("Assigned agent {} of task {} is no longer in the pool", agentId, task.id());
                continue;
            }
            Agent agent = maybeAgent.get();
            MdcContext.setAssignment(task.id(), agentId, task.primaryCapability().wireName());
            try {
                agent.release(task.id());
                if (result.success()) {
                    agent.performance().incrementTasksCompleted();
                }
                agent.performance().setLastActive(now);
                adaptations.addAll(learningController.recordOutcome(agent, task, duration, result.success(), now));
            } finally {
                MdcContext.clear();
            }
        }

        Settlement.Outcome outcome;
        if (result.success()) {
            outcome = Settlement.Outcome.COMPLETED;
            log.info("Task {} completed in {}ms by {}", task.id(), duration, agentIds);
        } else if (task.priority() == TaskPriority.CRITICAL && task.retryCount() < maxCriticalRetries) {
            task.resetForRetry();
            taskRegistry.requeueFront(task);
            outcome = Settlement.Outcome.REQUEUED;
            log.info("Critical task {} failed ({}), retry {}/{}", task.id(), result.detail(),
                    task.retryCount(), maxCriticalRetries);
        } else if (task.priority() == TaskPriority.CRITICAL) {
            outcome = Settlement.Outcome.RETRIES_EXHAUSTED;
            log.warn("Critical task {} failed ({}) and exhausted {} retries", task.id(), result.detail(),
                    maxCriticalRetries);
        } else {
            outcome = Settlement.Outcome.FAILED;
            log.info("Task {} failed after {}ms on {} ({})", task.id(), duration, agentIds, result.detail());
        }
        return new Settlement(task, outcome, result, agentIds, List.copyOf(adaptations));
    }
}
