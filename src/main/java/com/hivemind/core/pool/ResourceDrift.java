package com.hivemind.core.pool;

import com.hivemind.core.model.Agent;
import com.hivemind.core.model.ResourceUsage;

import java.util.Collection;
import java.util.Random;

/**
 * Nudges every agent's resource gauges by a bounded random step on each tick.
 * Stands in for real telemetry; gauges stay within [0, 1].
 */
public class ResourceDrift {

    private final Random random;
    private final double amplitude;

    public ResourceDrift(Random random, double amplitude) {
        this.random = random;
        this.amplitude = amplitude;
    }

    public void apply(Collection<Agent> agents) {
        for (Agent agent : agents) {
            ResourceUsage resources = agent.resources();
            resources.setCpu(resources.cpu() + step());
            resources.setMemory(resources.memory() + step());
            resources.setNetwork(resources.network() + step());
        }
    }

    private double step() {
        return (random.nextDouble() - 0.5) * amplitude;
    }
}
