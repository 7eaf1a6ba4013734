package com.hivemind.core.learning;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import com.hivemind.core.pool.AgentPool;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static com.hivemind.core.model.AgentFixtures.T0;
import static com.hivemind.core.model.AgentFixtures.agent;
import static org.junit.jupiter.api.Assertions.*;

class ScalingControllerTest {

    private final ScalingController scaling = new ScalingController(new Random(3), 0.8, 20, 5, 8);

    private static Task task(CapabilityType type) {
        return new Task("task-000009", TaskSpec.of("job", TaskPriority.HIGH, 9, type), T0);
    }

    @Test
    @DisplayName("Spawns when load exceeds the threshold")
    void spawnsUnderLoad() {
        var busy = agent("analytics-001", CapabilityType.ANALYTICS, 5, 2);
        busy.assign("t1");
        var pool = new AgentPool(List.of(busy));

        var spawned = scaling.considerSpawning(task(CapabilityType.ANALYTICS), pool, T0);

        assertTrue(spawned.isPresent());
        var agent = spawned.get();
        assertEquals("analytics-002", agent.id());
        assertEquals("ANALYTICS Agent 002", agent.name());
        assertEquals(AgentStatus.IDLE, agent.status());
        assertTrue(agent.taskHistory().isEmpty());
        assertTrue(pool.contains("analytics-002"));

        double level = agent.capability(CapabilityType.ANALYTICS).orElseThrow().level();
        assertTrue(level >= 5 && level <= 8, "level " + level);
        assertEquals(CapabilityType.ANALYTICS.defaultSpecializations().size(),
                agent.capability(CapabilityType.ANALYTICS).orElseThrow().specializations().size());
    }

    @Test
    @DisplayName("Load at exactly the threshold does not spawn")
    void thresholdIsStrict() {
        var agents = new ArrayList<Agent>();
        for (int i = 1; i <= 5; i++) {
            var a = agent("nlp-00" + i, CapabilityType.NLP, 9, 2);
            if (i <= 4) {
                a.assign("t" + i);
            }
            agents.add(a);
        }
        var pool = new AgentPool(agents);
        assertEquals(0.8, pool.systemLoad(), 1e-9);

        assertTrue(scaling.considerSpawning(task(CapabilityType.NLP), pool, T0).isEmpty());
        assertEquals(5, pool.size());
    }

    @Test
    @DisplayName("No spawn once the pool is at its maximum size")
    void maxPoolSize() {
        var small = new ScalingController(new Random(3), 0.8, 1, 5, 8);
        var busy = agent("nlp-001", CapabilityType.NLP, 5, 1);
        busy.assign("t1");
        var pool = new AgentPool(List.of(busy));

        assertTrue(small.considerSpawning(task(CapabilityType.NLP), pool, T0).isEmpty());
    }

    @Test
    @DisplayName("Spawned profile stays within its bounds")
    void spawnProfileBounds() {
        for (int i = 0; i < 50; i++) {
            var agent = scaling.spawn(CapabilityType.SECURITY, "security-" + String.format("%03d", i + 1), T0);
            var capability = agent.capability(CapabilityType.SECURITY).orElseThrow();
            assertTrue(capability.resourceCost() >= 2 && capability.resourceCost() <= 4);
            assertTrue(capability.maxConcurrentTasks() >= 3 && capability.maxConcurrentTasks() <= 5);
            assertTrue(agent.performance().successRate() >= 0.8 && agent.performance().successRate() <= 0.95);
            assertTrue(agent.performance().efficiency() >= 0.7 && agent.performance().efficiency() <= 0.9);
            assertEquals(0.2, agent.resources().memory(), 1e-9);
            assertTrue(agent.connections().isEmpty());
        }
    }

    @Test
    @DisplayName("Inverted level range is rejected")
    void invertedRange() {
        assertThrows(IllegalArgumentException.class, () -> new ScalingController(new Random(), 0.8, 20, 8, 5));
    }
}
