package com.hivemind.core.scheduler;

import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.hivemind.core.model.AgentFixtures.T0;
import static com.hivemind.core.model.AgentFixtures.agent;
import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private static Task task(String id, int complexity, CapabilityType type) {
        return new Task(id, TaskSpec.of("job", TaskPriority.MEDIUM, complexity, type), T0);
    }

    @Nested
    @DisplayName("Agent selection")
    class SelectionTests {

        private final TaskScheduler scheduler = new TaskScheduler(false);

        @Test
        @DisplayName("Highest score wins")
        void highestScoreWins() {
            var strong = agent("nlp-002", CapabilityType.NLP, 9, 3);
            var weaker = agent("nlp-001", CapabilityType.NLP, 6, 3);

            var chosen = scheduler.selectAgent(task("t", 5, CapabilityType.NLP), List.of(weaker, strong));

            assertEquals("nlp-002", chosen.orElseThrow().id());
        }

        @Test
        @DisplayName("Equal scores go to the lowest agent id")
        void tieBreakLowestId() {
            var b = agent("nlp-b", CapabilityType.NLP, 8, 3);
            var a = agent("nlp-a", CapabilityType.NLP, 8, 3);

            var chosen = scheduler.selectAgent(task("t", 5, CapabilityType.NLP), List.of(b, a));

            assertEquals("nlp-a", chosen.orElseThrow().id());
        }

        @Test
        @DisplayName("Load lowers the score")
        void loadLowersScore() {
            var busy = agent("nlp-001", CapabilityType.NLP, 8, 2);
            busy.assign("other");
            var idle = agent("nlp-002", CapabilityType.NLP, 8, 2);

            var chosen = scheduler.selectAgent(task("t", 5, CapabilityType.NLP), List.of(busy, idle));

            assertEquals("nlp-002", chosen.orElseThrow().id());
        }

        @Test
        @DisplayName("No eligible agent -> empty, not an exception")
        void noCandidate() {
            var weak = agent("nlp-001", CapabilityType.NLP, 5, 3);
            assertTrue(scheduler.selectAgent(task("t", 9, CapabilityType.NLP), List.of(weak)).isEmpty());
            assertTrue(scheduler.selectAgent(task("t", 3, CapabilityType.NLP), List.of()).isEmpty());
        }
    }

    @Nested
    @DisplayName("Dependency readiness")
    class ReadinessTests {

        @Test
        @DisplayName("Dependencies are ignored unless enforcement is on")
        void inertByDefault() {
            var scheduler = new TaskScheduler(false);
            var dependent = new Task("t2", TaskSpec.of("job", TaskPriority.LOW, 3, CapabilityType.NLP)
                    .withDependencies(Set.of("t1")), T0);
            assertTrue(scheduler.isReady(dependent, Map.of()));
            assertFalse(scheduler.enforcesDependencies());
        }

        @Test
        @DisplayName("With enforcement a task waits for every dependency to complete")
        void enforced() {
            var scheduler = new TaskScheduler(true);
            var dep = task("t1", 3, CapabilityType.NLP);
            var dependent = new Task("t2", TaskSpec.of("job", TaskPriority.LOW, 3, CapabilityType.NLP)
                    .withDependencies(Set.of("t1")), T0);
            var byId = Map.of("t1", dep, "t2", dependent);

            assertFalse(scheduler.isReady(dependent, byId));

            dep.markAssigned(List.of("a"));
            dep.markProcessing();
            dep.markCompleted(10);
            assertTrue(scheduler.isReady(dependent, byId));
        }

        @Test
        @DisplayName("Unknown or failed dependency keeps the task waiting")
        void unknownOrFailedDependency() {
            var scheduler = new TaskScheduler(true);
            var dep = task("t1", 3, CapabilityType.NLP);
            dep.markAssigned(List.of("a"));
            dep.markProcessing();
            dep.markFailed(10);
            var dependent = new Task("t2", TaskSpec.of("job", TaskPriority.LOW, 3, CapabilityType.NLP)
                    .withDependencies(Set.of("t1", "t9")), T0);

            assertFalse(scheduler.isReady(dependent, Map.of("t1", dep)));
        }
    }
}
