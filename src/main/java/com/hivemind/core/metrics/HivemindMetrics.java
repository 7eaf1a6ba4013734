package com.hivemind.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Centralised Micrometer metrics for task orchestration.
 * <p>
 * Counters count every attempt, so a critical task retried twice contributes two
 * failures here even though {@code OrchestrationMetrics.failedTasks} counts it once at most.
 */
@Service
public class HivemindMetrics {

    private final MeterRegistry registry;

    public HivemindMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordTaskSubmitted(String priority) {
        Counter.builder("hivemind.tasks.submitted")
                .tag("priority", priority)
                .register(registry)
                .increment();
    }

    public void recordTaskExecution(String capability, long ms) {
        Timer.builder("hivemind.task.duration")
                .tag("capability", capability)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordTaskOutcome(String outcome) {
        Counter.builder("hivemind.tasks.settled")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordNoCandidate(String capability) {
        Counter.builder("hivemind.scheduler.no_candidate")
                .description("Scheduling passes that found no eligible agent")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordAgentSpawned(String capability) {
        Counter.builder("hivemind.agents.spawned")
                .tag("capability", capability)
                .register(registry)
                .increment();
    }

    public void recordRetryDepth(int retries) {
        DistributionSummary.builder("hivemind.task.retries")
                .description("Retries used by critical tasks when they reach a terminal state")
                .register(registry)
                .record(retries);
    }

    public void recordCapabilityAdaptation(String capability, boolean improved) {
        Counter.builder("hivemind.learning.adaptations")
                .tag("capability", capability)
                .tag("direction", improved ? "up" : "down")
                .register(registry)
                .increment();
    }

    /**
     * Exposes a live value (queue length, system load) as a gauge.
     */
    public void registerGauge(String name, String description, Supplier<Number> value) {
        Gauge.builder(name, value)
                .description(description)
                .register(registry);
    }
}
