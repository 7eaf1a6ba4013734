package com.hivemind.core.learning;

import com.hivemind.core.model.CapabilityType;
import com.hivemind.core.model.Task;
import com.hivemind.core.model.TaskPriority;
import com.hivemind.core.model.TaskSpec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static com.hivemind.core.model.AgentFixtures.T0;
import static com.hivemind.core.model.AgentFixtures.agent;
import static com.hivemind.core.model.AgentFixtures.capability;
import static com.hivemind.core.model.AgentFixtures.multi;
import static org.junit.jupiter.api.Assertions.*;

class LearningControllerTest {

    private final LearningController learning = new LearningController(0.01, 0.005, 10, 100);

    private static Task task(CapabilityType... required) {
        return new Task("task-000001", TaskSpec.of("summarize", TaskPriority.MEDIUM, 3, required), T0);
    }

    @Nested
    @DisplayName("Capability adaptation")
    class AdaptationTests {

        @Test
        @DisplayName("Ten successes raise nlp by at most 0.1")
        void tenSuccessesBounded() {
            var a = agent("nlp-001", CapabilityType.NLP, 9, 5);
            for (int i = 0; i < 10; i++) {
                learning.recordOutcome(a, task(CapabilityType.NLP), 1000, true, T0);
            }
            double level = a.capability(CapabilityType.NLP).orElseThrow().level();
            assertEquals(9.1, level, 1e-9);
            assertEquals(10, a.adaptations().size());
        }

        @Test
        @DisplayName("Successes near the ceiling clamp at 10 and stop recording")
        void clampedAtCeiling() {
            var a = agent("nlp-001", CapabilityType.NLP, 9.975, 5);
            for (int i = 0; i < 10; i++) {
                learning.recordOutcome(a, task(CapabilityType.NLP), 1000, true, T0);
            }
            assertEquals(10.0, a.capability(CapabilityType.NLP).orElseThrow().level());
            assertEquals(3, a.adaptations().size(), "only level changes are recorded");
        }

        @Test
        @DisplayName("Failure lowers the level by 0.005")
        void failureLowers() {
            var a = agent("nlp-001", CapabilityType.NLP, 8, 5);
            var applied = learning.recordOutcome(a, task(CapabilityType.NLP), 1000, false, T0);

            assertEquals(7.995, a.capability(CapabilityType.NLP).orElseThrow().level(), 1e-9);
            assertEquals(1, applied.size());
            assertEquals(-0.005, applied.get(0).delta(), 1e-12);
        }

        @Test
        @DisplayName("Only required capabilities adapt")
        void onlyRequired() {
            var a = multi("m", capability(CapabilityType.NLP, 6, 2), capability(CapabilityType.SECURITY, 6, 2));
            learning.recordOutcome(a, task(CapabilityType.NLP), 500, true, T0);
            assertEquals(6.01, a.capability(CapabilityType.NLP).orElseThrow().level(), 1e-9);
            assertEquals(6.0, a.capability(CapabilityType.SECURITY).orElseThrow().level());
        }
    }

    @Nested
    @DisplayName("Performance window")
    class PerformanceTests {

        @Test
        @DisplayName("Success rate and average time use only the last ten outcomes")
        void slidingWindow() {
            var a = agent("nlp-001", CapabilityType.NLP, 8, 5);
            for (int i = 0; i < 5; i++) {
                learning.recordOutcome(a, task(CapabilityType.NLP), 9000, false, T0);
            }
            for (int i = 0; i < 10; i++) {
                learning.recordOutcome(a, task(CapabilityType.NLP), 2000, true, T0);
            }
            assertEquals(1.0, a.performance().successRate(), 1e-9);
            assertEquals(2000.0, a.performance().averageCompletionTime(), 1e-9);
            assertEquals(15, a.taskHistory().size());
        }

        @Test
        @DisplayName("efficiency = successRate / max(1, avgSeconds)")
        void efficiency() {
            var a = agent("nlp-001", CapabilityType.NLP, 8, 5);
            learning.recordOutcome(a, task(CapabilityType.NLP), 4000, true, T0);
            learning.recordOutcome(a, task(CapabilityType.NLP), 4000, false, T0);
            assertEquals(0.5, a.performance().successRate(), 1e-9);
            assertEquals(0.125, a.performance().efficiency(), 1e-9);

            var fast = agent("nlp-002", CapabilityType.NLP, 8, 5);
            learning.recordOutcome(fast, task(CapabilityType.NLP), 300, true, T0);
            assertEquals(1.0, fast.performance().efficiency(), 1e-9);
        }
    }

    @Test
    @DisplayName("A window below one is rejected")
    void rejectsEmptyWindow() {
        assertThrows(IllegalArgumentException.class, () -> new LearningController(0.01, 0.005, 0, 100));
    }
}
