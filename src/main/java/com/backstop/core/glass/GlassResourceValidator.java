package com.backstop.core.glass;

import com.backstop.core.metrics.BackstopMetrics;
import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ResourceKind;
import com.backstop.core.resource.CapabilityProbe;
import com.backstop.core.resource.ResourceCatalogValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Optional;

/**
 * Validates the glass resource set and recommends the tier the glass subsystem can run at.
 */
@Service
public class GlassResourceValidator {

    private static final Logger log = LoggerFactory.getLogger(GlassResourceValidator.class);

    private final ResourceCatalogValidator resourceValidator;
    private final CapabilityProbe capabilityProbe;
    private final Clock clock;
    private final BackstopMetrics metrics;

    public GlassResourceValidator(ResourceCatalogValidator resourceValidator,
                                  CapabilityProbe capabilityProbe,
                                  Clock clock,
                                  @Autowired(required = false) BackstopMetrics metrics) {
        this.resourceValidator = resourceValidator;
        this.capabilityProbe = capabilityProbe;
        this.clock = clock;
        this.metrics = metrics;
    }

    public DomainValidationReport validateAll() {
        long start = System.nanoTime();
        var perKind = new EnumMap<ResourceKind, KindValidationResult>(ResourceKind.class);
        int totalMissing = 0;

        for (ResourceKind kind : ResourceKind.values()) {
            List<ResourceDescriptor> descriptors = GlassResource.CATALOG.descriptors(kind);
            List<String> missing = resourceValidator.missing(descriptors);
            int fallbacks = (int) missing.stream()
                    .filter(name -> GlassResource.CATALOG.fallbackFor(name).isPresent())
                    .count();
            perKind.put(kind, new KindValidationResult(kind, descriptors.size(), missing, fallbacks));
            totalMissing += missing.size();
        }

        int total = GlassResource.CATALOG.size();
        int totalFallbacks = perKind.values().stream().mapToInt(KindValidationResult::fallbacksAvailable).sum();
        double missingPct = total == 0 ? 0.0 : totalMissing * 100.0 / total;
        boolean advanced = capabilityProbe.supportsAdvancedEffects();
        GlassTier tier = tierFor(missingPct, advanced);
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (metrics != null) {
            metrics.recordValidationDuration("glass", elapsed.toMillis());
        }
        if (totalMissing > 0) {
            log.warn("Glass validation: {}/{} resources missing ({}%), recommended tier {}",
                    totalMissing, total, String.format("%.1f", missingPct), tier);
        } else {
            log.info("Glass validation passed, advanced effects {}, recommended tier {}",
                    advanced ? "supported" : "unsupported", tier);
        }

        return new DomainValidationReport(perKind, total, totalMissing, totalFallbacks, missingPct,
                advanced, tier, elapsed, clock.instant());
    }

    /**
     * Tier policy: without advanced rendering the subsystem runs at {@code REDUCED}
     * whatever is present; otherwise the tier follows the missing percentage.
     */
    public static GlassTier tierFor(double missingPercentage, boolean advancedEffectsSupported) {
        if (!advancedEffectsSupported) {
            return GlassTier.REDUCED;
        }
        if (missingPercentage == 0.0) {
            return GlassTier.FULL;
        }
        if (missingPercentage <= 25.0) {
            return GlassTier.REDUCED;
        }
        if (missingPercentage <= 50.0) {
            return GlassTier.MINIMAL;
        }
        return GlassTier.NONE;
    }

    public Optional<String> fallbackFor(String resourceName) {
        return GlassResource.CATALOG.fallbackFor(resourceName);
    }

    public boolean canUseGlassEffects() {
        return validateAll().recommendedTier() != GlassTier.NONE;
    }

    public GlassStyle optimalStyle() {
        return GlassStyle.forTier(validateAll().recommendedTier());
    }
}
