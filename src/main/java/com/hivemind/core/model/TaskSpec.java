package com.hivemind.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a submitter provides for a new task. Identity, status, assignment and
 * creation time are assigned by the orchestrator.
 *
 * @param type                 free-form task kind, recorded in agent learning history
 * @param priority             urgency; CRITICAL failures are retried
 * @param complexity           1-10, also the minimum capability level required
 * @param requiredCapabilities non-empty, ordered; the first entry is the primary capability
 * @param payload              opaque data carried to the dispatcher
 * @param dependencies         ids of tasks this one depends on (gated only when enforcement is on)
 * @param estimatedDuration    submitter estimate in ms; 0 when unknown
 * @param deadline             optional, recorded only
 */
public record TaskSpec(
    String type,
    TaskPriority priority,
    int complexity,
    Set<CapabilityType> requiredCapabilities,
    Map<String, Object> payload,
    Set<String> dependencies,
    long estimatedDuration,
    Instant deadline
) {

    public static final int MIN_COMPLEXITY = 1;
    public static final int MAX_COMPLEXITY = 10;

    public TaskSpec {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("Task type is required");
        }
        if (priority == null) {
            throw new IllegalArgumentException("Task priority is required");
        }
        if (complexity < MIN_COMPLEXITY || complexity > MAX_COMPLEXITY) {
            throw new IllegalArgumentException("Task complexity must be within [1, 10], got " + complexity);
        }
        if (requiredCapabilities == null || requiredCapabilities.isEmpty()) {
            throw new IllegalArgumentException("Task must require at least one capability");
        }
        if (estimatedDuration < 0) {
            throw new IllegalArgumentException("estimatedDuration must not be negative");
        }
        requiredCapabilities = Collections.unmodifiableSet(new LinkedHashSet<>(requiredCapabilities));
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    /** Spec with no payload, dependencies, estimate or deadline. */
    public static TaskSpec of(String type, TaskPriority priority, int complexity, CapabilityType... required) {
        return new TaskSpec(type, priority, complexity, new LinkedHashSet<>(List.of(required)),
                Map.of(), Set.of(), 0L, null);
    }

    public TaskSpec withDependencies(Set<String> dependencyIds) {
        return new TaskSpec(type, priority, complexity, requiredCapabilities, payload, dependencyIds,
                estimatedDuration, deadline);
    }

    public TaskSpec withEstimatedDuration(long estimateMs) {
        return new TaskSpec(type, priority, complexity, requiredCapabilities, payload, dependencies,
                estimateMs, deadline);
    }

    public TaskSpec withPayload(Map<String, Object> data) {
        return new TaskSpec(type, priority, complexity, requiredCapabilities, data, dependencies,
                estimatedDuration, deadline);
    }
}
