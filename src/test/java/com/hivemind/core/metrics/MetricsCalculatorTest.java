package com.hivemind.core.metrics;

import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.OrchestrationMetrics;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import com.hivemind.core.pool.AgentPool;
import com.hivemind.core.registry.TaskRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.hivemind.core.model.AgentFixtures.T0;
import static com.hivemind.core.model.AgentFixtures.agent;
import static org.junit.jupiter.api.Assertions.*;

class MetricsCalculatorTest {

    private final MetricsCalculator calculator = new MetricsCalculator();
    private AgentPool pool;
    private TaskRegistry registry;

    @BeforeEach
    void setUp() {
        pool = new AgentPool(List.of(
                agent("nlp-001", CapabilityType.NLP, 9, 4),
                agent("quantum-001", CapabilityType.QUANTUM, 8, 4)));
        registry = new TaskRegistry(Clock.fixed(T0, ZoneOffset.UTC));
    }

    private Task run(long durationMs, boolean success) {
        Task task = registry.submit(TaskSpec.of("job", TaskPriority.MEDIUM, 3, CapabilityType.NLP));
        registry.dequeue(task);
        task.markAssigned(List.of("nlp-001"));
        task.markProcessing();
        if (success) {
            task.markCompleted(durationMs);
        } else {
            task.markFailed(durationMs);
        }
        return task;
    }

    @Test
    @DisplayName("Empty state yields zeros")
    void empty() {
        var m = calculator.compute(new AgentPool(), registry);
        assertEquals(OrchestrationMetrics.EMPTY, m);
    }

    @Test
    @DisplayName("Counts, averages and ratios derive from current state")
    void derived() {
        run(1000, true);
        run(3000, true);
        run(500, false);
        registry.submit(TaskSpec.of("job", TaskPriority.LOW, 3, CapabilityType.NLP));
        pool.require("nlp-001").assign("busy-1");

        var m = calculator.compute(pool, registry);

        assertEquals(4, m.totalTasks());
        assertEquals(2, m.completedTasks());
        assertEquals(1, m.failedTasks());
        assertEquals(2000.0, m.averageTaskTime(), 1e-9);
        assertEquals(0.5, m.systemLoad(), 1e-9);
        assertEquals(1.0 / 8, m.agentUtilization(), 1e-9);
        assertEquals(0.5, m.networkEfficiency(), 1e-9);
        assertEquals(1, m.queueLength());
    }

    @Test
    @DisplayName("A failed task reset for retry is no longer counted as failed")
    void retriedNotCounted() {
        Task task = run(500, false);
        task.resetForRetry();
        registry.requeueFront(task);

        var m = calculator.compute(pool, registry);

        assertEquals(0, m.failedTasks());
        assertEquals(1, m.queueLength());
    }

    @Test
    @DisplayName("Two computations without change are equal")
    void idempotent() {
        run(1000, true);
        assertEquals(calculator.compute(pool, registry), calculator.compute(pool, registry));
    }
}
