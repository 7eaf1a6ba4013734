package com.hivemind.core.scheduler;

import com.hivemind.core.model.AgentStatus;
import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hivemind.core.model.AgentFixtures.T0;
import static com.hivemind.core.model.AgentFixtures.agent;
import static com.hivemind.core.model.AgentFixtures.capability;
import static com.hivemind.core.model.AgentFixtures.multi;
import static org.junit.jupiter.api.Assertions.*;

class CandidateFilterTest {

    private final CandidateFilter filter = new CandidateFilter();

    private static Task task(int complexity, CapabilityType... required) {
        return new Task("task-000001", TaskSpec.of("job", TaskPriority.MEDIUM, complexity, required), T0);
    }

    @Nested
    @DisplayName("Capability levels")
    class CapabilityTests {

        @Test
        @DisplayName("Level equal to complexity qualifies, below does not")
        void levelThreshold() {
            var a = agent("q", CapabilityType.QUANTUM, 5, 3);
            assertTrue(filter.hasCapabilities(a, task(5, CapabilityType.QUANTUM)));
            assertFalse(filter.hasCapabilities(a, task(6, CapabilityType.QUANTUM)));
        }

        @Test
        @DisplayName("Every required capability must be present")
        void allRequired() {
            var a = multi("m", capability(CapabilityType.NLP, 8, 2), capability(CapabilityType.SECURITY, 8, 2));
            assertTrue(filter.hasCapabilities(a, task(4, CapabilityType.NLP, CapabilityType.SECURITY)));
            assertFalse(filter.hasCapabilities(a, task(4, CapabilityType.NLP, CapabilityType.QUANTUM)));
        }
    }

    @Nested
    @DisplayName("Availability")
    class AvailabilityTests {

        @Test
        @DisplayName("Idle and busy-with-room agents are available")
        void idleAndBusy() {
            var a = agent("n", CapabilityType.NLP, 9, 2);
            assertTrue(filter.isAvailable(a));
            a.assign("t1");
            assertTrue(filter.isAvailable(a));
        }

        @Test
        @DisplayName("Overloaded, offline and maintenance agents are not")
        void unavailableStatuses() {
            var overloaded = agent("n", CapabilityType.NLP, 9, 1);
            overloaded.assign("t1");
            assertFalse(filter.isAvailable(overloaded));

            var offline = agent("o", CapabilityType.NLP, 9, 3);
            offline.setStatus(AgentStatus.OFFLINE);
            assertFalse(filter.isAvailable(offline));

            var maintenance = agent("m", CapabilityType.NLP, 9, 3);
            maintenance.setStatus(AgentStatus.MAINTENANCE);
            assertFalse(filter.isAvailable(maintenance));
        }
    }

    @Nested
    @DisplayName("Resource headroom")
    class HeadroomTests {

        @Test
        @DisplayName("cpu + complexity*0.1 must stay strictly under 0.9")
        void cpuHeadroom() {
            var a = agent("n", CapabilityType.NLP, 9, 3);
            a.resources().setCpu(0.3);
            assertTrue(filter.hasHeadroom(a, task(5, CapabilityType.NLP)));
            a.resources().setCpu(0.45);
            assertFalse(filter.hasHeadroom(a, task(5, CapabilityType.NLP)));
        }

        @Test
        @DisplayName("Memory is checked the same way")
        void memoryHeadroom() {
            var a = agent("n", CapabilityType.NLP, 9, 3);
            a.resources().setMemory(0.6);
            assertFalse(filter.hasHeadroom(a, task(4, CapabilityType.NLP)));
            assertTrue(filter.hasHeadroom(a, task(2, CapabilityType.NLP)));
        }
    }

    @Test
    @DisplayName("eligible() keeps only agents passing all three checks")
    void eligibleCombinesChecks() {
        var good = agent("good", CapabilityType.NLP, 9, 3);
        var weak = agent("weak", CapabilityType.NLP, 3, 3);
        var hot = agent("hot", CapabilityType.NLP, 9, 3);
        hot.resources().setCpu(0.8);
        var off = agent("off", CapabilityType.NLP, 9, 3);
        off.setStatus(AgentStatus.OFFLINE);

        var result = filter.eligible(task(5, CapabilityType.NLP), List.of(good, weak, hot, off));

        assertEquals(List.of("good"), result.stream().map(a -> a.id()).toList());
    }
}
