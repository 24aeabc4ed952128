package com.backstop.core.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator backed by {@link HealthCheckService}.
 * Reports DOWN if any check is DOWN, DEGRADED if any is degraded, UP otherwise.
 */
@Component("backstopHealthIndicator")
public class BackstopHealthIndicator implements HealthIndicator {

    private final HealthCheckService healthCheckService;

    public BackstopHealthIndicator(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Health health() {
        var builder = Health.up();
        boolean anyDown = false;
        boolean anyDegraded = false;

        for (HealthStatus check : healthCheckService.checkAll()) {
            builder.withDetail(check.component(), check.status().name() + ": " + check.detail());
            anyDown |= check.status() == HealthStatus.Status.DOWN;
            anyDegraded |= check.status() == HealthStatus.Status.DEGRADED;
        }

        if (anyDown) {
            return builder.down().build();
        }
        return anyDegraded ? builder.status("DEGRADED").build() : builder.build();
    }
}
