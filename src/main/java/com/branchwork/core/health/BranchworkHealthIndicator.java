package com.branchwork.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator view of {@link HealthCheckService}. DEGRADED components report as UP with details.
 */
@Component
public class BranchworkHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public BranchworkHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var checks = healthCheckService.checkAll();
        Health.Builder builder = HealthStatus.overall(checks) == HealthStatus.Status.DOWN
                ? Health.down() : Health.up();
        for (var check : checks) {
            builder.withDetail(check.component(), check.status() + ": " + check.detail());
        }
        return builder.build();
    }
}
