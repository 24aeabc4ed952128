package com.backstop.core.glass;

import com.backstop.core.model.ResourceKind;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Result of validating the whole glass resource set.
 *
 * @param perKind                  per-kind outcome
 * @param totalResources           resources in the catalog
 * @param totalMissing             resources that failed to resolve or load
 * @param totalFallbacks           missing resources with a fallback
 * @param missingPercentage        {@code totalMissing / totalResources * 100}
 * @param advancedEffectsSupported what the capability probe reported
 * @param recommendedTier          tier the subsystem should run at
 * @param validationTime           how long the pass took
 * @param timestamp                when the pass ran
 */
public record DomainValidationReport(
    Map<ResourceKind, KindValidationResult> perKind,
    int totalResources,
    int totalMissing,
    int totalFallbacks,
    double missingPercentage,
    boolean advancedEffectsSupported,
    GlassTier recommendedTier,
    Duration validationTime,
    Instant timestamp
) {

    public DomainValidationReport {
        var copy = new EnumMap<ResourceKind, KindValidationResult>(ResourceKind.class);
        copy.putAll(perKind);
        perKind = Collections.unmodifiableMap(copy);
    }

    public boolean allAvailable() {
        return totalMissing == 0;
    }
}
