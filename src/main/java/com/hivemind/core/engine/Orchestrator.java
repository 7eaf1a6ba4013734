package com.hivemind.core.engine;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.events.EventBus;
import com.hivemind.core.events.EventType;
import com.hivemind.core.events.OrchestratorEvent;
import com.hivemind.core.execution.DispatchResult;
import com.hivemind.core.execution.ExecutionEngine;
import com.hivemind.core.execution.Settlement;
import com.hivemind.core.execution.TaskDispatcher;
import com.hivemind.core.learning.LearningController;
import com.hivemind.core.learning.ScalingController;
import com.hivemind.core.logging.MdcContext;
import com.hivemind.core.metrics.HivemindMetrics;
import com.hivemind.core.metrics.MetricsCalculator;
import com.hivemind.core.model.Adaptation;
import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.OrchestrationMetrics;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import com.hivemind.core.model.TaskStatus;
import com.hivemind.core.pool.AgentPool;
import com.hivemind.core.pool.ResourceDrift;
import com.hivemind.core.registry.TaskRegistry;
import com.hivemind.core.scheduler.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owns an agent pool and a task registry and drives tasks through
 * submit, match, dispatch, settle, learn and scale.
 * <p>
 * Every mutation of pool or registry state happens under one reentrant lock: submissions,
 * dispatch completions (on whatever thread completes the dispatcher's future), administrative
 * agent changes and the periodic tick. Event subscribers are called while that lock is held,
 * on the thread that caused the change. All returned agents and tasks are detached copies.
 * <p>
 * Lifecycle is explicit: {@link #start()} begins the periodic tick (metrics, resource drift,
 * scheduling and scaling pass), {@link #stop()} ends it.
 */
public class Orchestrator {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    private final AgentPool agentPool;
    private final TaskRegistry taskRegistry;
    private final TaskScheduler scheduler;
    private final ExecutionEngine executionEngine;
    private final ScalingController scalingController;
    private final EventBus eventBus;
    private final MetricsCalculator metricsCalculator = new MetricsCalculator();
    private final ResourceDrift resourceDrift;
    private final HivemindMetrics meters;
    private final Clock clock;
    private final long tickIntervalMs;

    private final ReentrantLock stateLock = new ReentrantLock();
    private boolean draining;
    private boolean drainRequested;
    private volatile OrchestrationMetrics latestMetrics = OrchestrationMetrics.EMPTY;

    private ScheduledExecutorService tickExecutor;
    private volatile boolean running;

    public Orchestrator(HivemindProperties properties, AgentPool agentPool, TaskRegistry taskRegistry,
                        TaskDispatcher dispatcher, EventBus eventBus, HivemindMetrics meters,
                        Clock clock, Random random) {
        this.agentPool = agentPool;
        this.taskRegistry = taskRegistry;
        this.eventBus = eventBus;
        this.meters = meters;
        this.clock = clock;
        this.tickIntervalMs = properties.getTickIntervalMs();

        this.scheduler = new TaskScheduler(properties.getScheduler().isEnforceDependencies());
        var learning = properties.getLearning();
        var learningController = new LearningController(learning.getSuccessDelta(), learning.getFailureDelta(),
                learning.getPerformanceWindow(), learning.getHistoryLimit());
        var scaling = properties.getScaling();
        this.scalingController = new ScalingController(random, scaling.getLoadThreshold(), scaling.getMaxPoolSize(),
                scaling.getMinSpawnLevel(), scaling.getMaxSpawnLevel());
        var execution = properties.getExecution();
        var simulation = properties.getSimulation();
        this.executionEngine = new ExecutionEngine(agentPool, taskRegistry, learningController, dispatcher, clock,
                execution.getMaxCriticalRetries(), execution.getWatchdogMultiplier(),
                simulation.getMsPerComplexity(), simulation.getJitterMs(), simulation.getTimeScale());
        this.resourceDrift = new ResourceDrift(random, properties.getPool().getDriftAmplitude());

        refreshMetrics();
        if (meters != null) {
            meters.registerGauge("hivemind.queue.length", "Tasks waiting for an agent",
                    () -> latestMetrics.queueLength());
            meters.registerGauge("hivemind.system.load", "Fraction of agents busy or overloaded",
                    () -> latestMetrics.systemLoad());
            meters.registerGauge("hivemind.agents.utilization", "Bound task slots over total slots",
                    () -> latestMetrics.agentUtilization());
        }
    }

    // -- Lifecycle ------------------------------------------------------------

    public void start() {
        stateLock.lock();
        try {
            if (running) {
                return;
            }
            tickExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "hivemind-tick");
                t.setDaemon(true);
                return t;
            });
            tickExecutor.scheduleAtFixedRate(this::safeTick, tickIntervalMs, tickIntervalMs, TimeUnit.MILLISECONDS);
            running = true;
            log.info("Orchestrator started with {} agent(s), tick every {}ms", agentPool.size(), tickIntervalMs);
        } finally {
            stateLock.unlock();
        }
    }

    public void stop() {
        stateLock.lock();
        try {
            if (!running) {
                return;
            }
            tickExecutor.shutdownNow();
            tickExecutor = null;
            running = false;
            log.info("Orchestrator stopped ({} task(s), {} pending)", taskRegistry.size(), taskRegistry.queueLength());
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isRunning() {
        return running;
    }

    // -- Submission -----------------------------------------------------------

    /**
     * Registers a task and runs one scheduling pass for it. Returns as soon as the
     * scheduling decision is made; execution proceeds asynchronously.
     *
     * @return the orchestrator-assigned task id
     */
    public String submitTask(TaskSpec spec) {
        stateLock.lock();
        try {
            Task task = taskRegistry.submit(spec);
            if (meters != null) {
                meters.recordTaskSubmitted(spec.priority().wireName());
            }
            MdcContext.setTask(task.id());
            try {
                publish(EventType.TASK_SUBMITTED, task.id(), null, Map.of("task", task.copy()));
            } finally {
                MdcContext.clear();
            }

            boolean spawned = scheduleTask(task, true);
            if (spawned) {
                schedulePending(false);
            }
            refreshMetrics();
            return task.id();
        } finally {
            stateLock.unlock();
        }
    }

    // -- Queries --------------------------------------------------------------

    public List<Agent> getAgents() {
        stateLock.lock();
        try {
            return agentPool.snapshot();
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<Agent> getAgent(String agentId) {
        stateLock.lock();
        try {
            return agentPool.get(agentId).map(Agent::copy);
        } finally {
            stateLock.unlock();
        }
    }

    public List<Task> getTasks() {
        stateLock.lock();
        try {
            return taskRegistry.list().stream().map(Task::copy).toList();
        } finally {
            stateLock.unlock();
        }
    }

    public Optional<Task> getTask(String taskId) {
        stateLock.lock();
        try {
            return taskRegistry.get(taskId).map(Task::copy);
        } finally {
            stateLock.unlock();
        }
    }

    /** Pending tasks in the order the scheduler will consider them. */
    public List<Task> getTaskQueue() {
        stateLock.lock();
        try {
            return taskRegistry.pending().stream().map(Task::copy).toList();
        } finally {
            stateLock.unlock();
        }
    }

    public OrchestrationMetrics getMetrics() {
        stateLock.lock();
        try {
            return refreshMetrics();
        } finally {
            stateLock.unlock();
        }
    }

    // -- Subscriptions --------------------------------------------------------

    public EventBus.Subscription subscribe(EventType type, Consumer<OrchestratorEvent> handler) {
        return eventBus.subscribe(type, handler);
    }

    public EventBus.Subscription subscribe(String eventName, Consumer<OrchestratorEvent> handler) {
        return eventBus.subscribe(EventType.fromName(eventName), handler);
    }

    public EventBus.Subscription subscribeAll(Consumer<OrchestratorEvent> handler) {
        return eventBus.subscribeAll(handler);
    }

    // -- Agent administration -------------------------------------------------

    public void registerAgent(Agent agent) {
        stateLock.lock();
        try {
            MdcContext.setAgent(agent.id());
            try {
                agentPool.register(agent);
            } finally {
                MdcContext.clear();
            }
            schedulePending(true);
            refreshMetrics();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Removes an agent that holds no tasks.
     *
     * @return a copy of the removed agent
     * @throws com.hivemind.core.pool.AgentBusyException if the agent still holds tasks
     * @throws com.hivemind.core.pool.UnknownAgentException if no such agent exists
     */
    public Agent removeAgent(String agentId) {
        stateLock.lock();
        try {
            MdcContext.setAgent(agentId);
            Agent removed;
            try {
                removed = agentPool.remove(agentId);
            } finally {
                MdcContext.clear();
            }
            refreshMetrics();
            return removed.copy();
        } finally {
            stateLock.unlock();
        }
    }

    /**
     * Takes an agent out of service (OFFLINE, MAINTENANCE) or returns it to service
     * (any other status), in which case pending tasks get a scheduling pass.
     */
    public Agent setAgentStatus(String agentId, AgentStatus status) {
        stateLock.lock();
        try {
            Agent agent = agentPool.setStatus(agentId, status);
            if (!status.isAdministrative()) {
                schedulePending(true);
            }
            refreshMetrics();
            return agent.copy();
        } finally {
            stateLock.unlock();
        }
    }

    // -- Tick -----------------------------------------------------------------

    /**
     * One periodic step: drift resource gauges, give pending tasks a scheduling and
     * scaling opportunity, recompute metrics and publish them.
     */
    public void runTick() {
        stateLock.lock();
        try {
            resourceDrift.apply(agentPool.list());
            schedulePending(true);
            OrchestrationMetrics metrics = refreshMetrics();
            publish(EventType.METRICS_UPDATED, null, null, Map.of("metrics", metrics));
        } finally {
            stateLock.unlock();
        }
    }

    private void safeTick() {
        try {
            runTick();
        } catch (RuntimeException e) {
            log.error("Orchestrator tick failed: {}", e.getMessage(), e);
        }
    }

    // -- Scheduling (callers hold stateLock) ----------------------------------

    /**
     * One scheduling pass for a pending task.
     *
     * @return true if the pass spawned a new agent
     */
    private boolean scheduleTask(Task task, boolean allowScaling) {
        if (task.status() != TaskStatus.PENDING) {
            return false;
        }
        if (!scheduler.isReady(task, tasksById())) {
            return false;
        }
        Optional<Agent> best = scheduler.selectAgent(task, agentPool.list());
        if (best.isPresent()) {
            bind(task, best.get());
            return false;
        }

        if (meters != null) {
            meters.recordNoCandidate(task.primaryCapability().wireName());
        }
        if (!allowScaling) {
            return false;
        }
        Optional<Agent> spawned = scalingController.considerSpawning(task, agentPool, clock.instant());
        spawned.ifPresent(agent -> {
            if (meters != null) {
                meters.recordAgentSpawned(task.primaryCapability().wireName());
            }
            publish(EventType.AGENT_SPAWNED, task.id(), agent.id(), Map.of("agent", agent.copy()));
        });
        return spawned.isPresent();
    }

    /**
     * Scheduling pass over the whole queue, front first. A pass that spawned agents is
     * followed by one pass without scaling so the new agents can pick up work. Re-entrant
     * calls (a dispatch settling synchronously inside a pass) are folded into the running loop.
     */
    private void schedulePending(boolean allowScaling) {
        if (draining) {
            drainRequested = true;
            return;
        }
        draining = true;
        try {
            boolean scaling = allowScaling;
            boolean again;
            do {
                drainRequested = false;
                boolean spawned = false;
                for (Task task : taskRegistry.pending()) {
                    spawned |= scheduleTask(task, scaling);
                }
                again = drainRequested || spawned;
                if (spawned) {
                    scaling = false;
                }
            } while (again);
        } finally {
            draining = false;
        }
    }

    private void bind(Task task, Agent agent) {
        MdcContext.setAssignment(task.id(), agent.id(), task.primaryCapability().wireName());
        try {
            task.markAssigned(List.of(agent.id()));
            agent.assign(task.id());
            taskRegistry.dequeue(task);
            log.info("Assigned task {} to {} ({} {}/{})", task.id(), agent.id(), agent.status().wireName(),
                    agent.currentTasks().size(), agent.maxConcurrentTasks());
            publish(EventType.TASK_ASSIGNED, task.id(), agent.id(),
                    Map.of("task", task.copy(), "agents", List.of(agent.copy())));

            CompletableFuture<DispatchResult> outcome = executionEngine.start(task);
            publish(EventType.TASK_STARTED, task.id(), agent.id(), Map.of("task", task.copy()));
            outcome.whenComplete((result, error) -> onDispatchSettled(task, result, error));
        } finally {
            MdcContext.clear();
        }
    }

    private void onDispatchSettled(Task task, DispatchResult result, Throwable error) {
        stateLock.lock();
        try {
            DispatchResult effective = result != null ? result
                    : DispatchResult.failure(0, "dispatch error: " + (error != null ? error.getMessage() : "no result"));
            Settlement settlement = executionEngine.settle(task, effective);
            recordSettlement(settlement);

            Map<String, Object> payload = new HashMap<>();
            payload.put("task", task.copy());
            payload.put("result", effective);
            payload.put("adaptations", settlement.adaptations());
            payload.put("requeued", settlement.outcome() == Settlement.Outcome.REQUEUED);
            payload.put("retriesExhausted", settlement.outcome() == Settlement.Outcome.RETRIES_EXHAUSTED);
            String agentId = settlement.agentIds().isEmpty() ? null : settlement.agentIds().get(0);
            publish(settlement.succeeded() ? EventType.TASK_COMPLETED : EventType.TASK_FAILED,
                    task.id(), agentId, payload);

            OrchestrationMetrics metrics = refreshMetrics();
            publish(EventType.METRICS_UPDATED, null, null, Map.of("metrics", metrics));

            schedulePending(true);
            refreshMetrics();
        } finally {
            stateLock.unlock();
        }
    }

    private void recordSettlement(Settlement settlement) {
        if (meters == null) {
            return;
        }
        Task task = settlement.task();
        meters.recordTaskExecution(task.primaryCapability().wireName(), settlement.result().durationMs());
        meters.recordTaskOutcome(settlement.outcome().name().toLowerCase());
        for (Adaptation adaptation : settlement.adaptations()) {
            meters.recordCapabilityAdaptation(adaptation.capability().wireName(), adaptation.delta() > 0);
        }
        if (task.priority() == TaskPriority.CRITICAL && settlement.outcome() != Settlement.Outcome.REQUEUED) {
            meters.recordRetryDepth(task.retryCount());
        }
    }

    private Map<String, Task> tasksById() {
        var byId = new HashMap<String, Task>();
        for (Task task : taskRegistry.list()) {
            byId.put(task.id(), task);
        }
        return byId;
    }

    private OrchestrationMetrics refreshMetrics() {
        latestMetrics = metricsCalculator.compute(agentPool, taskRegistry);
        return latestMetrics;
    }

    private void publish(EventType type, String taskId, String agentId, Map<String, Object> payload) {
        eventBus.publish(new OrchestratorEvent(type, taskId, agentId, payload, clock.instant()));
    }
}
