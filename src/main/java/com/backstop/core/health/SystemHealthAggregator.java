package com.backstop.core.health;

import com.backstop.core.model.HealthBucket;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Combines per-component health buckets into one {@link SystemHealth}. Pure.
 */
@Component
public class SystemHealthAggregator {

    private final HealthProperties properties;

    public SystemHealthAggregator(HealthProperties properties) {
        this.properties = properties;
    }

    public SystemHealth aggregate(Map<String, HealthBucket> components) {
        int total = components.size();
        int normal = 0;
        int degraded = 0;
        int nearFailed = 0;
        int failed = 0;
        for (HealthBucket bucket : components.values()) {
            switch (bucket) {
                case NORMAL -> normal++;
                case DEGRADED -> degraded++;
                case NEAR_FAILED -> nearFailed++;
                case FAILED -> failed++;
            }
        }

        double healthPercentage = total == 0 ? 100.0 : normal * 100.0 / total;
        boolean canRecover = degraded + nearFailed > 0;
        return new SystemHealth(tierFor(total, degraded, nearFailed, failed), total, normal,
                degraded + nearFailed, failed, canRecover, healthPercentage, components);
    }

    SystemTier tierFor(int total, int degraded, int nearFailed, int failed) {
        if (total == 0) {
            return SystemTier.NORMAL;
        }
        double failedRatio = (double) failed / total;
        double emergencyRatio = (double) (failed + nearFailed) / total;
        double degradedRatio = (double) (failed + nearFailed + degraded) / total;
        if (failedRatio > properties.getCriticalRatio()) {
            return SystemTier.CRITICAL;
        }
        if (emergencyRatio > properties.getEmergencyRatio()) {
            return SystemTier.EMERGENCY;
        }
        if (degradedRatio > properties.getDegradedRatio()) {
            return SystemTier.DEGRADED;
        }
        return SystemTier.NORMAL;
    }

    /**
     * Tier to start in, from the number of resources missing at pre-flight.
     */
    public SystemTier initialTier(int missingResourceCount) {
        if (missingResourceCount == 0) {
            return SystemTier.NORMAL;
        }
        if (missingResourceCount <= 5) {
            return SystemTier.DEGRADED;
        }
        if (missingResourceCount <= 15) {
            return SystemTier.EMERGENCY;
        }
        return SystemTier.CRITICAL;
    }
}
