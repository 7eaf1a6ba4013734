package com.hivemind.core.learning;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentPerformance;
import com.hivemind.core.model.Capability;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Location;
import com.hivemind.core.model.ResourceUsage;
import com.hivemind.core.model.Task;
import com.hivemind.core.pool.AgentPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

/**
 * Grows the pool when a task finds no candidate while most agents are busy.
 * <p>
 * A spawn happens only when {@code systemLoad > loadThreshold} and the pool is below
 * {@code maxPoolSize}. The new agent offers the task's primary capability at a random
 * level within [minSpawnLevel, maxSpawnLevel].
 */
public class ScalingController {

    private static final Logger log = LoggerFactory.getLogger(ScalingController.class);

    private final Random random;
    private final double loadThreshold;
    private final int maxPoolSize;
    private final double minSpawnLevel;
    private final double maxSpawnLevel;

    public ScalingController(Random random, double loadThreshold, int maxPoolSize,
                             double minSpawnLevel, double maxSpawnLevel) {
        if (minSpawnLevel > maxSpawnLevel) {
            throw new IllegalArgumentException("minSpawnLevel must not exceed maxSpawnLevel");
        }
        this.random = random;
        this.loadThreshold = loadThreshold;
        this.maxPoolSize = maxPoolSize;
        this.minSpawnLevel = minSpawnLevel;
        this.maxSpawnLevel = maxSpawnLevel;
    }

    /**
     * Called when a task had no candidate. Registers and returns a new agent if the
     * pool is loaded past the threshold and still has room.
     */
    public Optional<Agent> considerSpawning(Task task, AgentPool pool, Instant now) {
        double load = pool.systemLoad();
        if (load <= loadThreshold) {
            log.debug("No spawn for {}: load {} <= {}", task.id(), String.format("%.2f", load), loadThreshold);
            return Optional.empty();
        }
        if (pool.size() >= maxPoolSize) {
            log.debug("No spawn for {}: pool at maximum size {}", task.id(), maxPoolSize);
            return Optional.empty();
        }
        Agent agent = spawn(task.primaryCapability(), pool.nextAgentId(task.primaryCapability()), now);
        pool.register(agent);
        log.info("Spawned agent {} for unmet {} demand (load={}, pool={})",
                agent.id(), task.primaryCapability().wireName(), String.format("%.2f", load), pool.size());
        return Optional.of(agent);
    }

    Agent spawn(CapabilityType type, String agentId, Instant now) {
        double level = minSpawnLevel + random.nextDouble() * (maxSpawnLevel - minSpawnLevel);
        Set<String> specializations = new LinkedHashSet<>(type.defaultSpecializations());
        var capability = new Capability(type, level, specializations,
                2 + random.nextDouble() * 2,
                3 + random.nextInt(3));
        var performance = new AgentPerformance(0, 0,
                0.8 + random.nextDouble() * 0.15,
                0.7 + random.nextDouble() * 0.2,
                now);
        var location = new Location(100 + random.nextDouble() * 500, 50 + random.nextDouble() * 300);
        String suffix = agentId.substring(agentId.length() - 3);
        return new Agent(agentId, type.name() + " Agent " + suffix, List.of(capability), performance,
                new ResourceUsage(0.1, 0.2, 0.1), location, Set.of());
    }

    public double loadThreshold() { return loadThreshold; }
    public int maxPoolSize() { return maxPoolSize; }
}
