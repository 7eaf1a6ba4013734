package com.hivemind.core.model;

import java.time.Instant;

/**
 * Rolling performance figures of an agent, recomputed by the learning controller.
 */
public class AgentPerformance {

    private int tasksCompleted;
    private double averageCompletionTime;
    private double successRate;
    private double efficiency;
    private Instant lastActive;

    public AgentPerformance(int tasksCompleted, double averageCompletionTime, double successRate,
                            double efficiency, Instant lastActive) {
        this.tasksCompleted = tasksCompleted;
        this.averageCompletionTime = averageCompletionTime;
        this.successRate = successRate;
        this.efficiency = efficiency;
        this.lastActive = lastActive;
    }

    public int tasksCompleted() { return tasksCompleted; }
    public double averageCompletionTime() { return averageCompletionTime; }
    public double successRate() { return successRate; }
    public double efficiency() { return efficiency; }
    public Instant lastActive() { return lastActive; }

    public void incrementTasksCompleted() { tasksCompleted++; }
    public void setAverageCompletionTime(double averageCompletionTime) { this.averageCompletionTime = averageCompletionTime; }
    public void setSuccessRate(double successRate) { this.successRate = successRate; }
    public void setEfficiency(double efficiency) { this.efficiency = efficiency; }
    public void setLastActive(Instant lastActive) { this.lastActive = lastActive; }

    public AgentPerformance copy() {
        return new AgentPerformance(tasksCompleted, averageCompletionTime, successRate, efficiency, lastActive);
    }
}
