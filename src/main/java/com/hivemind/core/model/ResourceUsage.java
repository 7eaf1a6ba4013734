package com.hivemind.core.model;

/**
 * CPU, memory and network gauges of an agent, each kept within [0, 1].
 */
public class ResourceUsage {

    private double cpu;
    private double memory;
    private double network;

    public ResourceUsage(double cpu, double memory, double network) {
        this.cpu = clamp(cpu);
        this.memory = clamp(memory);
        this.network = clamp(network);
    }

    public double cpu() { return cpu; }
    public double memory() { return memory; }
    public double network() { return network; }

    public void setCpu(double cpu) { this.cpu = clamp(cpu); }
    public void setMemory(double memory) { this.memory = clamp(memory); }
    public void setNetwork(double network) { this.network = clamp(network); }

    /** Highest of the three gauges. */
    public double peak() {
        return Math.max(cpu, Math.max(memory, network));
    }

    public ResourceUsage copy() {
        return new ResourceUsage(cpu, memory, network);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
