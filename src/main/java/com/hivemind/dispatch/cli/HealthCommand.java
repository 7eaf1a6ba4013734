package com.hivemind.dispatch.cli;

import com.hivemind.core.health.HealthCheckService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: hivemind health
 * <p>
 * Runs the orchestrator health checks and displays results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check orchestrator health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return;
        }

        var checks = healthCheckService.checkAll();
        boolean allUp = true;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.info(label);
                    allUp = false;
                }
            }
        }

        ConsoleOutput.rule();
        if (allUp) {
            ConsoleOutput.success("Overall: orchestrator operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
