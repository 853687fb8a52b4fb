package com.vulnconsole.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Publishes the container runtime check on the actuator health endpoint.
 */
@Component("containerRuntime")
public class RuntimeHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public RuntimeHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        HealthStatus status = healthCheckService.checkRuntime();
        Health.Builder builder = status.status() == HealthStatus.Status.UP ? Health.up() : Health.down();
        return builder.withDetail("detail", status.detail()).build();
    }
}
