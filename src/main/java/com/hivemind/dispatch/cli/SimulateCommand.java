package com.hivemind.dispatch.cli;

import com.hivemind.core.engine.Orchestrator;
import com.hivemind.core.events.EventType;
import com.hivemind.core.events.OrchestratorEvent;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.Capability;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * CLI command: hivemind simulate --tasks N
 * <p>
 * Submits generated tasks against the pool's capabilities, waits until each one is
 * terminal (completed, or failed with no retry pending) and prints the resulting metrics.
 */
@Command(name = "simulate", mixinStandardHelpOptions = true, description = "Run a simulated workload")
@Component
public class SimulateCommand implements Runnable {

    /** Spawned agents top out below this, so harder tasks could wait forever. */
    static final int MAX_GENERATED_COMPLEXITY = 8;

    @Option(names = {"--tasks", "-n"}, description = "Number of tasks to submit (default: ${DEFAULT-VALUE})",
            defaultValue = "10")
    private int tasks;

    @Option(names = {"--seed"}, description = "Seed for task generation")
    private Long seed;

    @Option(names = {"--critical-ratio"}, description = "Share of critical tasks (default: ${DEFAULT-VALUE})",
            defaultValue = "0.1")
    private double criticalRatio;

    @Option(names = {"--timeout-seconds"}, description = "Give up waiting after this long (default: ${DEFAULT-VALUE})",
            defaultValue = "120")
    private long timeoutSeconds;

    @Option(names = {"--watch", "-w"}, description = "Print orchestrator events as they happen")
    private boolean watch;

    private final Orchestrator orchestrator;

    public SimulateCommand(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (tasks < 1) {
            ConsoleOutput.error("--tasks must be at least 1");
            return;
        }
        if (criticalRatio < 0 || criticalRatio > 1) {
            ConsoleOutput.error("--critical-ratio must be within [0, 1]");
            return;
        }
        List<CapabilityType> available = poolCapabilities();
        if (available.isEmpty()) {
            ConsoleOutput.error("Agent pool is empty; nothing can execute tasks");
            return;
        }

        Random random = seed != null ? new Random(seed) : new Random();
        var finished = new CountDownLatch(tasks);
        var subscription = orchestrator.subscribeAll(event -> {
            if (watch) {
                printEvent(event);
            }
            if (isTerminal(event)) {
                finished.countDown();
            }
        });

        ConsoleOutput.info("Submitting " + tasks + " task(s) across " + available);
        try {
            for (int i = 0; i < tasks; i++) {
                orchestrator.submitTask(generate(random, available, i));
            }
            if (finished.await(timeoutSeconds, TimeUnit.SECONDS)) {
                ConsoleOutput.success("All " + tasks + " task(s) reached a terminal state");
            } else {
                ConsoleOutput.error(finished.getCount() + " task(s) still open after " + timeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            ConsoleOutput.error("Interrupted while waiting for tasks");
        } finally {
            subscription.unsubscribe();
        }

        ConsoleOutput.metrics(orchestrator.getMetrics());
    }

    TaskSpec generate(Random random, List<CapabilityType> available, int index) {
        CapabilityType capability = available.get(random.nextInt(available.size()));
        TaskPriority priority;
        if (random.nextDouble() < criticalRatio) {
            priority = TaskPriority.CRITICAL;
        } else {
            priority = TaskPriority.values()[random.nextInt(TaskPriority.CRITICAL.ordinal())];
        }
        int complexity = 1 + random.nextInt(MAX_GENERATED_COMPLEXITY);
        return TaskSpec.of(capability.wireName() + "-job-" + index, priority, complexity, capability);
    }

    private List<CapabilityType> poolCapabilities() {
        var types = new ArrayList<CapabilityType>();
        for (Agent agent : orchestrator.getAgents()) {
            for (Capability capability : agent.capabilities()) {
                if (!types.contains(capability.type())) {
                    types.add(capability.type());
                }
            }
        }
        return types;
    }

    static boolean isTerminal(OrchestratorEvent event) {
        if (event.type() == EventType.TASK_COMPLETED) {
            return true;
        }
        if (event.type() == EventType.TASK_FAILED) {
            Boolean requeued = event.payloadValue("requeued");
            return !Boolean.TRUE.equals(requeued);
        }
        return false;
    }

    private static void printEvent(OrchestratorEvent event) {
        if (event.type() == EventType.METRICS_UPDATED) {
            return;
        }
        String data;
        if (event.type() == EventType.AGENT_SPAWNED) {
            data = event.agentId() + " for " + event.taskId();
        } else {
            Task task = event.payloadValue("task");
            data = event.taskId() + (event.agentId() != null ? " @ " + event.agentId() : "")
                    + (task != null ? " (" + task.priority().wireName() + ", c" + task.complexity() + ")" : "");
        }
        ConsoleOutput.event(event.type().eventName(), data);
    }
}
