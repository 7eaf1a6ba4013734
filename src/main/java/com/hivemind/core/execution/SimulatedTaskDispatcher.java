package com.hivemind.core.execution;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Stand-in dispatcher that performs no work.
 * <p>
 * Duration is {@code complexity * msPerComplexity + u * jitterMs}. The result is
 * delivered on a scheduler thread after {@code duration * timeScale} ms of wall time,
 * so {@code timeScale = 0} completes as soon as the scheduler runs it. Success is drawn
 * when the duration has elapsed, against the mean success rate of the assigned agents
 * as they were when the task was dispatched.
 */
public class SimulatedTaskDispatcher implements TaskDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedTaskDispatcher.class);

    private final ScheduledExecutorService scheduler;
    private final Random random;
    private final long msPerComplexity;
    private final long jitterMs;
    private final double timeScale;

    public SimulatedTaskDispatcher(Random random, long msPerComplexity, long jitterMs, double timeScale) {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "hivemind-simulator");
            t.setDaemon(true);
            return t;
        }), random, msPerComplexity, jitterMs, timeScale);
    }

    SimulatedTaskDispatcher(ScheduledExecutorService scheduler, Random random, long msPerComplexity,
                            long jitterMs, double timeScale) {
        if (timeScale < 0) {
            throw new IllegalArgumentException("timeScale must not be negative");
        }
        this.scheduler = scheduler;
        this.random = random;
        this.msPerComplexity = msPerComplexity;
        this.jitterMs = jitterMs;
        this.timeScale = timeScale;
    }

    @Override
    public CompletableFuture<DispatchResult> dispatch(Task task, List<Agent> agents) {
        long duration = simulatedDuration(task);
        double probability = successProbability(agents);
        long wallDelay = Math.round(duration * timeScale);
        log.debug("Simulating {} for {}ms (wall {}ms)", task.id(), duration, wallDelay);

        var future = new CompletableFuture<DispatchResult>();
        scheduler.schedule(() -> future.complete(outcome(task, duration, probability)),
                wallDelay, TimeUnit.MILLISECONDS);
        return future;
    }

    private DispatchResult outcome(Task task, long duration, double probability) {
        boolean success = random.nextDouble() < probability;
        log.debug("Simulated {} finished: {}", task.id(), success ? "success" : "failure");
        return success
                ? DispatchResult.success(duration)
                : DispatchResult.failure(duration, "simulated failure");
    }

    long simulatedDuration(Task task) {
        return task.complexity() * msPerComplexity + Math.round(random.nextDouble() * jitterMs);
    }

    static double successProbability(List<Agent> agents) {
        return agents.stream()
                .mapToDouble(a -> a.performance().successRate())
                .average()
                .orElse(0.0);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
