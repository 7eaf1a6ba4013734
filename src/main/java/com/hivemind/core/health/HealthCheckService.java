package com.hivemind.core.health;

import com.hivemind.config.HivemindProperties;
import com.hivemind.core.engine.Orchestrator;
import com.hivemind.core.model.Agent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final Orchestrator orchestrator;
    private final HivemindProperties properties;

    public HealthCheckService(
            @Autowired(required = false) Orchestrator orchestrator,
            HivemindProperties properties) {
        this.orchestrator = orchestrator;
        this.properties = properties;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkTick());
        results.add(checkPool());
        results.add(checkQueue());
        return results;
    }

    private HealthStatus checkTick() {
        if (orchestrator == null) {
            return new HealthStatus("orchestrator", HealthStatus.Status.DOWN,
                    "Orchestrator not available", Map.of());
        }
        if (orchestrator.isRunning()) {
            return new HealthStatus("orchestrator", HealthStatus.Status.UP,
                    "Tick running every " + properties.getTickIntervalMs() + "ms", Map.of());
        }
        return new HealthStatus("orchestrator", HealthStatus.Status.DOWN,
                "Tick not running", Map.of());
    }

    private HealthStatus checkPool() {
        if (orchestrator == null) {
            return new HealthStatus("pool", HealthStatus.Status.DOWN,
                    "No agent pool", Map.of());
        }
        List<Agent> agents = orchestrator.getAgents();
        long inService = agents.stream().filter(a -> !a.status().isAdministrative()).count();
        long withCapacity = agents.stream()
                .filter(a -> !a.status().isAdministrative() && a.hasCapacity())
                .count();
        var metadata = Map.of(
                "agents", String.valueOf(agents.size()),
                "inService", String.valueOf(inService),
                "withCapacity", String.valueOf(withCapacity));

        if (inService == 0) {
            return new HealthStatus("pool", HealthStatus.Status.DOWN,
                    "No agents in service (" + agents.size() + " registered)", metadata);
        }
        if (withCapacity == 0) {
            return new HealthStatus("pool", HealthStatus.Status.DEGRADED,
                    "All " + inService + " in-service agent(s) at capacity", metadata);
        }
        return new HealthStatus("pool", HealthStatus.Status.UP,
                withCapacity + " of " + inService + " in-service agent(s) have capacity", metadata);
    }

    private HealthStatus checkQueue() {
        if (orchestrator == null) {
            return new HealthStatus("queue", HealthStatus.Status.DOWN,
                    "No task registry", Map.of());
        }
        var metrics = orchestrator.getMetrics();
        var metadata = Map.of(
                "queueLength", String.valueOf(metrics.queueLength()),
                "systemLoad", String.format("%.2f", metrics.systemLoad()));
        int poolSize = orchestrator.getAgents().size();
        boolean saturated = metrics.systemLoad() > properties.getScaling().getLoadThreshold()
                && poolSize >= properties.getScaling().getMaxPoolSize()
                && metrics.queueLength() > 0;
        if (saturated) {
            log.warn("Pool saturated: {} agent(s) at load {}, {} task(s) waiting",
                    poolSize, metrics.systemLoad(), metrics.queueLength());
            return new HealthStatus("queue", HealthStatus.Status.DEGRADED,
                    metrics.queueLength() + " task(s) waiting on a saturated pool", metadata);
        }
        return new HealthStatus("queue", HealthStatus.Status.UP,
                metrics.queueLength() + " task(s) waiting", metadata);
    }
}
