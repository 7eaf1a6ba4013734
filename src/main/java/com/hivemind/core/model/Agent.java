package com.hivemind.core.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A capability-bearing worker owned by the agent pool.
 * <p>
 * Instances held by the orchestrator are mutated only under its state lock.
 * Everything handed to callers outside the orchestrator is a {@link #copy()}.
 * <p>
 * Load invariant: {@code currentTasks().size() <= maxConcurrentTasks()}, and unless the
 * agent is OFFLINE or MAINTENANCE its status is IDLE when empty, OVERLOADED at the bound
 * and BUSY in between.
 */
public class Agent {

    /** Default number of history and adaptation entries kept per agent. */
    public static final int DEFAULT_LOG_LIMIT = 100;

    private final String id;
    private final String name;
    private final List<Capability> capabilities;
    private AgentStatus status;
    private final Set<String> currentTasks = new LinkedHashSet<>();
    private final AgentPerformance performance;
    private final ResourceUsage resources;
    private final Location location;
    private final Set<String> connections;
    private final Deque<TaskHistoryEntry> taskHistory = new ArrayDeque<>();
    private final Deque<Adaptation> adaptations = new ArrayDeque<>();

    public Agent(String id, String name, List<Capability> capabilities, AgentPerformance performance,
                 ResourceUsage resources, Location location, Set<String> connections) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Agent id is required");
        }
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("Agent " + id + " must declare at least one capability");
        }
        this.id = id;
        this.name = name != null ? name : id;
        this.capabilities = new ArrayList<>(capabilities);
        this.performance = performance;
        this.resources = resources;
        this.location = location != null ? location : new Location(0, 0);
        this.connections = connections == null ? Set.of() : Set.copyOf(connections);
        this.status = AgentStatus.IDLE;
    }

    public String id() { return id; }
    public String name() { return name; }
    public List<Capability> capabilities() { return Collections.unmodifiableList(capabilities); }
    public AgentStatus status() { return status; }
    public Set<String> currentTasks() { return Collections.unmodifiableSet(currentTasks); }
    public AgentPerformance performance() { return performance; }
    public ResourceUsage resources() { return resources; }
    public Location location() { return location; }
    public Set<String> connections() { return connections; }
    public List<TaskHistoryEntry> taskHistory() { return List.copyOf(taskHistory); }
    public List<Adaptation> adaptations() { return List.copyOf(adaptations); }

    public Optional<Capability> capability(CapabilityType type) {
        return capabilities.stream().filter(c -> c.type() == type).findFirst();
    }

    /** Largest {@code maxConcurrentTasks} across the agent's capabilities. */
    public int maxConcurrentTasks() {
        int max = 1;
        for (Capability capability : capabilities) {
            max = Math.max(max, capability.maxConcurrentTasks());
        }
        return max;
    }

    public boolean hasCapacity() {
        return currentTasks.size() < maxConcurrentTasks();
    }

    public boolean isBusyOrOverloaded() {
        return status == AgentStatus.BUSY || status == AgentStatus.OVERLOADED;
    }

    /**
     * Binds a task to this agent and recomputes the derived status.
     *
     * @throws IllegalStateException if the agent is already at its concurrency bound
     */
    public void assign(String taskId) {
        if (!hasCapacity()) {
            throw new IllegalStateException("Agent " + id + " is at capacity ("
                    + currentTasks.size() + "/" + maxConcurrentTasks() + ")");
        }
        currentTasks.add(taskId);
        recomputeStatus();
    }

    public boolean release(String taskId) {
        boolean removed = currentTasks.remove(taskId);
        recomputeStatus();
        return removed;
    }

    /**
     * Sets an administrative status. Passing a load-derived status (IDLE, BUSY,
     * OVERLOADED) returns the agent to service with its status derived from load.
     */
    public void setStatus(AgentStatus requested) {
        if (requested.isAdministrative()) {
            status = requested;
        } else {
            status = AgentStatus.IDLE;
            recomputeStatus();
        }
    }

    public void recomputeStatus() {
        if (status.isAdministrative()) {
            return;
        }
        if (currentTasks.isEmpty()) {
            status = AgentStatus.IDLE;
        } else if (currentTasks.size() >= maxConcurrentTasks()) {
            status = AgentStatus.OVERLOADED;
        } else {
            status = AgentStatus.BUSY;
        }
    }

    public void appendHistory(TaskHistoryEntry entry, int limit) {
        taskHistory.addLast(entry);
        while (taskHistory.size() > limit) {
            taskHistory.removeFirst();
        }
    }

    public void appendAdaptation(Adaptation adaptation, int limit) {
        adaptations.addLast(adaptation);
        while (adaptations.size() > limit) {
            adaptations.removeFirst();
        }
    }

    /** The last {@code window} history entries, oldest first. */
    public List<TaskHistoryEntry> recentHistory(int window) {
        List<TaskHistoryEntry> all = new ArrayList<>(taskHistory);
        return all.subList(Math.max(0, all.size() - window), all.size());
    }

    /** Deep copy, detached from the orchestrator's live state. */
    public Agent copy() {
        List<Capability> capabilityCopies = new ArrayList<>();
        for (Capability capability : capabilities) {
            capabilityCopies.add(capability.copy());
        }
        Agent copy = new Agent(id, name, capabilityCopies, performance.copy(), resources.copy(),
                location, connections);
        copy.status = status;
        copy.currentTasks.addAll(currentTasks);
        copy.taskHistory.addAll(taskHistory);
        copy.adaptations.addAll(adaptations);
        return copy;
    }

    @Override
    public String toString() {
        return "Agent[" + id + ", " + status.wireName() + ", " + currentTasks.size() + "/" + maxConcurrentTasks()
                + ", " + capabilities + "]";
    }
}
