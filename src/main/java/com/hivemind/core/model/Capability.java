package com.hivemind.core.model;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A typed, leveled skill attached to an agent.
 * <p>
 * {@code level} is the only mutable field and always stays within
 * [{@link #MIN_LEVEL}, {@link #MAX_LEVEL}].
 */
public class Capability {

    public static final double MIN_LEVEL = 1.0;
    public static final double MAX_LEVEL = 10.0;

    private final CapabilityType type;
    private double level;
    private final Set<String> specializations;
    private final double resourceCost;
    private final int maxConcurrentTasks;

    public Capability(CapabilityType type, double level, Set<String> specializations,
                      double resourceCost, int maxConcurrentTasks) {
        if (type == null) {
            throw new IllegalArgumentException("Capability type is required");
        }
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be at least 1, got " + maxConcurrentTasks);
        }
        this.type = type;
        this.level = clamp(level);
        this.specializations = specializations == null ? Set.of() : Set.copyOf(new LinkedHashSet<>(specializations));
        this.resourceCost = resourceCost;
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    public CapabilityType type() { return type; }
    public double level() { return level; }
    public Set<String> specializations() { return specializations; }
    public double resourceCost() { return resourceCost; }
    public int maxConcurrentTasks() { return maxConcurrentTasks; }

    /**
     * Shifts the level by {@code delta}, clamped to [1, 10].
     *
     * @return true if the stored level actually changed
     */
    public boolean adjustLevel(double delta) {
        double next = clamp(level + delta);
        if (next == level) {
            return false;
        }
        level = next;
        return true;
    }

    public Capability copy() {
        return new Capability(type, level, specializations, resourceCost, maxConcurrentTasks);
    }

    private static double clamp(double value) {
        return Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, value));
    }

    @Override
    public String toString() {
        return type.wireName() + "@" + String.format("%.2f", level);
    }
}
