package com.backstop.core.glass;

import com.backstop.core.model.DegradationTier;
import com.backstop.core.model.HealthBucket;

/**
 * Capability tiers of the glass effects subsystem, best first.
 */
public enum GlassTier implements DegradationTier {
    /** Blur, translucency, shadows and animations. */
    FULL(HealthBucket.NORMAL),
    /** Translucency without blur. */
    REDUCED(HealthBucket.DEGRADED),
    /** Mostly opaque surfaces, no effects. */
    MINIMAL(HealthBucket.NEAR_FAILED),
    /** Plain opaque styling. */
    NONE(HealthBucket.FAILED);

    private final HealthBucket bucket;

    GlassTier(HealthBucket bucket) {
        this.bucket = bucket;
    }

    @Override
    public HealthBucket bucket() {
        return bucket;
    }
}
