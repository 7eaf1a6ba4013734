package com.hivemind.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hivemind.core.model.AgentFixtures.T0;
import static com.hivemind.core.model.AgentFixtures.agent;
import static com.hivemind.core.model.AgentFixtures.capability;
import static com.hivemind.core.model.AgentFixtures.multi;
import static org.junit.jupiter.api.Assertions.*;

class AgentTest {

    @Nested
    @DisplayName("Load-derived status")
    class StatusTests {

        @Test
        @DisplayName("New agent is idle")
        void newAgentIdle() {
            var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
            assertEquals(AgentStatus.IDLE, a.status());
            assertTrue(a.hasCapacity());
        }

        @Test
        @DisplayName("idle -> busy -> overloaded -> busy -> idle as tasks bind and release")
        void statusFollowsLoad() {
            var a = agent("nlp-001", CapabilityType.NLP, 9, 2);

            a.assign("t1");
            assertEquals(AgentStatus.BUSY, a.status());

            a.assign("t2");
            assertEquals(AgentStatus.OVERLOADED, a.status());
            assertFalse(a.hasCapacity());

            a.release("t1");
            assertEquals(AgentStatus.BUSY, a.status());

            a.release("t2");
            assertEquals(AgentStatus.IDLE, a.status());
        }

        @Test
        @DisplayName("Single-slot agent goes straight to overloaded")
        void singleSlotOverloaded() {
            var a = agent("swarm-001", CapabilityType.SWARM, 10, 1);
            a.assign("t1");
            assertEquals(AgentStatus.OVERLOADED, a.status());
        }

        @Test
        @DisplayName("Assigning past the bound is rejected")
        void assignPastBoundRejected() {
            var a = agent("nlp-001", CapabilityType.NLP, 9, 1);
            a.assign("t1");
            assertThrows(IllegalStateException.class, () -> a.assign("t2"));
            assertEquals(1, a.currentTasks().size());
        }

        @Test
        @DisplayName("Administrative status sticks across release until returned to service")
        void administrativeStatusSticks() {
            var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
            a.assign("t1");
            a.setStatus(AgentStatus.MAINTENANCE);
            a.release("t1");
            assertEquals(AgentStatus.MAINTENANCE, a.status());

            a.setStatus(AgentStatus.IDLE);
            assertEquals(AgentStatus.IDLE, a.status());
        }

        @Test
        @DisplayName("Returning to service recomputes from load, not the requested value")
        void returnToServiceRecomputes() {
            var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
            a.assign("t1");
            a.setStatus(AgentStatus.OFFLINE);
            a.setStatus(AgentStatus.IDLE);
            assertEquals(AgentStatus.BUSY, a.status());
        }
    }

    @Test
    @DisplayName("Concurrency bound is the largest across capabilities")
    void maxConcurrentAcrossCapabilities() {
        var a = multi("mixed",
                capability(CapabilityType.NLP, 5, 2),
                capability(CapabilityType.ANALYTICS, 5, 6));
        assertEquals(6, a.maxConcurrentTasks());
        assertTrue(a.capability(CapabilityType.ANALYTICS).isPresent());
        assertTrue(a.capability(CapabilityType.QUANTUM).isEmpty());
    }

    @Test
    @DisplayName("An agent needs at least one capability")
    void requiresCapability() {
        assertThrows(IllegalArgumentException.class, () -> new Agent("x", "x", List.of(),
                new AgentPerformance(0, 0, 1, 1, T0), new ResourceUsage(0, 0, 0), null, null));
    }

    @Test
    @DisplayName("History keeps only the newest entries up to the limit")
    void historyBounded() {
        var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
        for (int i = 0; i < 5; i++) {
            a.appendHistory(new TaskHistoryEntry("job", i * 100L, true), 3);
        }
        assertEquals(3, a.taskHistory().size());
        assertEquals(200L, a.taskHistory().get(0).durationMs());
        assertEquals(List.of(300L, 400L),
                a.recentHistory(2).stream().map(TaskHistoryEntry::durationMs).toList());
    }

    @Test
    @DisplayName("copy() is detached from the original")
    void copyIsDetached() {
        var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
        a.assign("t1");
        var copy = a.copy();

        a.release("t1");
        a.capability(CapabilityType.NLP).orElseThrow().adjustLevel(0.5);
        a.resources().setCpu(0.7);

        assertEquals(1, copy.currentTasks().size());
        assertEquals(AgentStatus.BUSY, copy.status());
        assertEquals(9.0, copy.capability(CapabilityType.NLP).orElseThrow().level());
        assertEquals(0.1, copy.resources().cpu(), 1e-9);
    }
}
