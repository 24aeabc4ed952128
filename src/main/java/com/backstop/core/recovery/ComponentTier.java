package com.backstop.core.recovery;

import com.backstop.core.model.DegradationTier;
import com.backstop.core.model.HealthBucket;

/**
 * Degradation tiers of a generic UI component, best first.
 */
public enum ComponentTier implements DegradationTier {
    NORMAL(HealthBucket.NORMAL),
    /** Simplified variant of the component. */
    REDUCED(HealthBucket.DEGRADED),
    /** Standard platform widget in place of the custom one. */
    FALLBACK(HealthBucket.DEGRADED),
    /** Bare-bones substitute. */
    EMERGENCY(HealthBucket.NEAR_FAILED),
    FAILED(HealthBucket.FAILED);

    private final HealthBucket bucket;

    ComponentTier(HealthBucket bucket) {
        this.bucket = bucket;
    }

    @Override
    public HealthBucket bucket() {
        return bucket;
    }
}
