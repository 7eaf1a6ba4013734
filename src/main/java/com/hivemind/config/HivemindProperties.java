package com.hivemind.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "hivemind")
public class HivemindProperties {

    private long tickIntervalMs = 1000;
    private Scheduler scheduler = new Scheduler();
    private Scaling scaling = new Scaling();
    private Learning learning = new Learning();
    private Execution execution = new Execution();
    private Simulation simulation = new Simulation();
    private Pool pool = new Pool();

    public long getTickIntervalMs() { return tickIntervalMs; }
    public void setTickIntervalMs(long tickIntervalMs) { this.tickIntervalMs = tickIntervalMs; }
    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }
    public Scaling getScaling() { return scaling; }
    public void setScaling(Scaling scaling) { this.scaling = scaling; }
    public Learning getLearning() { return learning; }
    public void setLearning(Learning learning) { this.learning = learning; }
    public Execution getExecution() { return execution; }
    public void setExecution(Execution execution) { this.execution = execution; }
    public Simulation getSimulation() { return simulation; }
    public void setSimulation(Simulation simulation) { this.simulation = simulation; }
    public Pool getPool() { return pool; }
    public void setPool(Pool pool) { this.pool = pool; }

    public static class Scheduler {
        /** When true, a task stays pending until every dependency id names a completed task. */
        private boolean enforceDependencies = false;

        public boolean isEnforceDependencies() { return enforceDependencies; }
        public void setEnforceDependencies(boolean enforceDependencies) { this.enforceDependencies = enforceDependencies; }
    }

    public static class Scaling {
        private double loadThreshold = 0.8;
        private int maxPoolSize = 20;
        private double minSpawnLevel = 5;
        private double maxSpawnLevel = 8;

        public double getLoadThreshold() { return loadThreshold; }
        public void setLoadThreshold(double loadThreshold) { this.loadThreshold = loadThreshold; }
        public int getMaxPoolSize() { return maxPoolSize; }
        public void setMaxPoolSize(int maxPoolSize) { this.maxPoolSize = maxPoolSize; }
        public double getMinSpawnLevel() { return minSpawnLevel; }
        public void setMinSpawnLevel(double minSpawnLevel) { this.minSpawnLevel = minSpawnLevel; }
        public double getMaxSpawnLevel() { return maxSpawnLevel; }
        public void setMaxSpawnLevel(double maxSpawnLevel) { this.maxSpawnLevel = maxSpawnLevel; }
    }

    public static class Learning {
        private double successDelta = 0.01;
        private double failureDelta = 0.005;
        private int performanceWindow = 10;
        private int historyLimit = 100;

        public double getSuccessDelta() { return successDelta; }
        public void setSuccessDelta(double successDelta) { this.successDelta = successDelta; }
        public double getFailureDelta() { return failureDelta; }
        public void setFailureDelta(double failureDelta) { this.failureDelta = failureDelta; }
        public int getPerformanceWindow() { return performanceWindow; }
        public void setPerformanceWindow(int performanceWindow) { this.performanceWindow = performanceWindow; }
        public int getHistoryLimit() { return historyLimit; }
        public void setHistoryLimit(int historyLimit) { this.historyLimit = historyLimit; }
    }

    public static class Execution {
        private int maxCriticalRetries = 3;
        /** Multiple of the worst-case duration after which a dispatch is failed; 0 (default) disables. */
        private double watchdogMultiplier = 0;

        public int getMaxCriticalRetries() { return maxCriticalRetries; }
        public void setMaxCriticalRetries(int maxCriticalRetries) { this.maxCriticalRetries = maxCriticalRetries; }
        public double getWatchdogMultiplier() { return watchdogMultiplier; }
        public void setWatchdogMultiplier(double watchdogMultiplier) { this.watchdogMultiplier = watchdogMultiplier; }
    }

    public static class Simulation {
        private long msPerComplexity = 1000;
        private long jitterMs = 2000;
        private double timeScale = 1.0;
        /** Fixed seed for reproducible runs; random when unset. */
        private Long seed;

        public long getMsPerComplexity() { return msPerComplexity; }
        public void setMsPerComplexity(long msPerComplexity) { this.msPerComplexity = msPerComplexity; }
        public long getJitterMs() { return jitterMs; }
        public void setJitterMs(long jitterMs) { this.jitterMs = jitterMs; }
        public double getTimeScale() { return timeScale; }
        public void setTimeScale(double timeScale) { this.timeScale = timeScale; }
        public Long getSeed() { return seed; }
        public void setSeed(Long seed) { this.seed = seed; }
    }

    public static class Pool {
        private String seedResource = "classpath:seed-agents.json";
        private double driftAmplitude = 0.1;

        public String getSeedResource() { return seedResource; }
        public void setSeedResource(String seedResource) { this.seedResource = seedResource; }
        public double getDriftAmplitude() { return driftAmplitude; }
        public void setDriftAmplitude(double driftAmplitude) { this.driftAmplitude = driftAmplitude; }
    }
}
