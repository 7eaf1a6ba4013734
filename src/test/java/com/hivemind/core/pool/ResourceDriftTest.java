package com.hivemind.core.pool;

import com.hivemind.core.model.CapabilityType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static com.hivemind.core.model.AgentFixtures.agent;
import static org.junit.jupiter.api.Assertions.*;

class ResourceDriftTest {

    @Test
    @DisplayName("Each step moves a gauge by at most half the amplitude")
    void boundedStep() {
        var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
        var drift = new ResourceDrift(new Random(42), 0.1);

        double before = a.resources().cpu();
        drift.apply(List.of(a));

        assertTrue(Math.abs(a.resources().cpu() - before) <= 0.05 + 1e-12);
    }

    @Test
    @DisplayName("Gauges stay within [0, 1] under repeated large drift")
    void staysClamped() {
        var a = agent("nlp-001", CapabilityType.NLP, 9, 3);
        var drift = new ResourceDrift(new Random(7), 2.0);
        for (int i = 0; i < 200; i++) {
            drift.apply(List.of(a));
            assertTrue(a.resources().cpu() >= 0 && a.resources().cpu() <= 1);
            assertTrue(a.resources().memory() >= 0 && a.resources().memory() <= 1);
            assertTrue(a.resources().network() >= 0 && a.resources().network() <= 1);
        }
    }
}
