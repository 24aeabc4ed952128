package com.backstop.core.health;

import com.backstop.core.model.HealthBucket;

import java.util.Map;

/**
 * Derived view of system health.
 *
 * @param tier             system tier
 * @param total            tracked components
 * @param normal           components in the normal bucket
 * @param degraded         components degraded or near failed
 * @param failed           components at a terminal tier
 * @param canRecover       true when at least one component below normal is not terminal
 * @param healthPercentage {@code normal / total * 100}, 100 when nothing is tracked
 * @param components       bucket per component id
 */
public record SystemHealth(
    SystemTier tier,
    int total,
    int normal,
    int degraded,
    int failed,
    boolean canRecover,
    double healthPercentage,
    Map<String, HealthBucket> components
) {

    public SystemHealth {
        components = Map.copyOf(components);
    }
}
