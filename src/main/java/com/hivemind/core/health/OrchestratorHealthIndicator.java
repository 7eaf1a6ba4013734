package com.hivemind.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator built from {@link HealthCheckService}. DOWN if any
 * component is down, DEGRADED if any is degraded, UP otherwise. Each component's
 * detail is included.
 */
@Component("orchestratorHealthIndicator")
public class OrchestratorHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public OrchestratorHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        boolean anyDown = false;
        boolean anyDegraded = false;
        var builder = Health.up();
        for (HealthStatus check : healthCheckService.checkAll()) {
            builder.withDetail(check.component(), check.status() + ": " + check.detail());
            switch (check.status()) {
                case DOWN -> anyDown = true;
                case DEGRADED -> anyDegraded = true;
                default -> { }
            }
        }
        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
