package com.hivemind.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Set;

/** Agent builders shared by tests. */
public final class AgentFixtures {

    public static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private AgentFixtures() {}

    public static Agent agent(String id, CapabilityType type, double level, int maxConcurrent) {
        return agent(id, type, level, maxConcurrent, 0.9, 0.8);
    }

    public static Agent agent(String id, CapabilityType type, double level, int maxConcurrent,
                              double successRate, double efficiency) {
        var capability = new Capability(type, level, Set.copyOf(type.defaultSpecializations()), 2.0, maxConcurrent);
        return new Agent(id, id.toUpperCase(), List.of(capability),
                new AgentPerformance(0, 0, successRate, efficiency, T0),
                new ResourceUsage(0.1, 0.1, 0.1), new Location(0, 0), Set.of());
    }

    public static Agent multi(String id, Capability... capabilities) {
        return new Agent(id, id, List.of(capabilities),
                new AgentPerformance(0, 0, 0.9, 0.8, T0),
                new ResourceUsage(0.1, 0.1, 0.1), new Location(0, 0), Set.of());
    }

    public static Capability capability(CapabilityType type, double level, int maxConcurrent) {
        return new Capability(type, level, Set.of(), 1.0, maxConcurrent);
    }
}
