package com.hivemind.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A submitted unit of work and its lifecycle state.
 * <p>
 * {@code assignedAgents} is non-empty exactly when the status is not PENDING.
 * Instances owned by the orchestrator are mutated only under its state lock;
 * callers receive {@link #copy()}s.
 */
public class Task {

    private final String id;
    private final String type;
    private final TaskPriority priority;
    private final int complexity;
    private final Set<CapabilityType> requiredCapabilities;
    private final Map<String, Object> payload;
    private final Set<String> dependencies;
    private final Instant createdAt;
    private final long estimatedDuration;
    private final Instant deadline;
    private TaskStatus status = TaskStatus.PENDING;
    private final List<String> assignedAgents = new ArrayList<>();
    private Long actualDuration;
    private int retryCount;

    public Task(String id, TaskSpec spec, Instant createdAt) {
        this.id = id;
        this.type = spec.type();
        this.priority = spec.priority();
        this.complexity = spec.complexity();
        this.requiredCapabilities = spec.requiredCapabilities();
        this.payload = spec.payload();
        this.dependencies = spec.dependencies();
        this.createdAt = createdAt;
        this.estimatedDuration = spec.estimatedDuration();
        this.deadline = spec.deadline();
    }

    public String id() { return id; }
    public String type() { return type; }
    public TaskPriority priority() { return priority; }
    public int complexity() { return complexity; }
    public Set<CapabilityType> requiredCapabilities() { return requiredCapabilities; }
    public Map<String, Object> payload() { return payload; }
    public Set<String> dependencies() { return dependencies; }
    public Instant createdAt() { return createdAt; }
    public long estimatedDuration() { return estimatedDuration; }
    public Instant deadline() { return deadline; }
    public TaskStatus status() { return status; }
    public List<String> assignedAgents() { return Collections.unmodifiableList(assignedAgents); }
    public Long actualDuration() { return actualDuration; }
    public int retryCount() { return retryCount; }

    /** First required capability; used when the pool scales for this task. */
    public CapabilityType primaryCapability() {
        return requiredCapabilities.iterator().next();
    }

    public void markAssigned(List<String> agentIds) {
        requireStatus(TaskStatus.PENDING);
        if (agentIds == null || agentIds.isEmpty()) {
            throw new IllegalArgumentException("Task " + id + " must be assigned to at least one agent");
        }
        assignedAgents.clear();
        assignedAgents.addAll(agentIds);
        status = TaskStatus.ASSIGNED;
    }

    public void markProcessing() {
        requireStatus(TaskStatus.ASSIGNED);
        status = TaskStatus.PROCESSING;
    }

    public void markCompleted(long durationMs) {
        requireStatus(TaskStatus.PROCESSING);
        status = TaskStatus.COMPLETED;
        actualDuration = durationMs;
    }

    public void markFailed(long durationMs) {
        requireStatus(TaskStatus.PROCESSING);
        status = TaskStatus.FAILED;
        actualDuration = durationMs;
    }

    /** Returns a failed task to the queue for another attempt. */
    public void resetForRetry() {
        requireStatus(TaskStatus.FAILED);
        status = TaskStatus.PENDING;
        assignedAgents.clear();
        retryCount++;
    }

    private void requireStatus(TaskStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Task " + id + " is " + status.wireName()
                    + ", expected " + expected.wireName());
        }
    }

    public Task copy() {
        Task copy = new Task(id, new TaskSpec(type, priority, complexity, requiredCapabilities, payload,
                dependencies, estimatedDuration, deadline), createdAt);
        copy.status = status;
        copy.assignedAgents.addAll(assignedAgents);
        copy.actualDuration = actualDuration;
        copy.retryCount = retryCount;
        return copy;
    }

    @Override
    public String toString() {
        return "Task[" + id + ", " + type + ", " + priority.wireName() + ", c=" + complexity + ", "
                + status.wireName() + ", agents=" + assignedAgents + "]";
    }
}
