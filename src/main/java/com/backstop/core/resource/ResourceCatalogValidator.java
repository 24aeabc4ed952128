package com.backstop.core.resource;

import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ResourceKind;
import com.backstop.core.model.ValidationReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks whether named resources resolve and load in the current environment.
 * <p>
 * A single pass is authoritative for the calling instant: no retries, no caching.
 * Both "did not resolve" and "resolved but failed to load" count as missing.
 */
@Service
public class ResourceCatalogValidator {

    private static final Logger log = LoggerFactory.getLogger(ResourceCatalogValidator.class);

    private final ResourceEnvironment environment;
    private final Clock clock;

    public ResourceCatalogValidator(ResourceEnvironment environment, Clock clock) {
        this.environment = environment;
        this.clock = clock;
    }

    /**
     * Validates a catalog; missing resources with a catalog fallback count toward
     * {@link ValidationReport#fallbacksAvailable()}.
     */
    public ValidationReport validate(ResourceCatalog catalog) {
        var report = validate(catalog.descriptors(), catalog.namesWithFallback());
        if (!report.allAvailable()) {
            log.warn("Catalog '{}' validation: {} missing, {} with fallback, action {}",
                    catalog.name(), report.missingCount(), report.fallbacksAvailable(), report.recommendedAction());
        } else {
            log.debug("Catalog '{}' validation passed ({} resources)", catalog.name(), catalog.size());
        }
        return report;
    }

    /**
     * Validates an ad-hoc list of descriptors that have no fallback table.
     */
    public ValidationReport validate(List<ResourceDescriptor> descriptors) {
        return validate(descriptors, Set.of());
    }

    /**
     * Returns the fallback for every resource of the catalog that is currently missing
     * and has one.
     */
    public Map<String, String> fallbackMap(ResourceCatalog catalog) {
        var mapping = new LinkedHashMap<String, String>();
        for (String name : validate(catalog).allMissing()) {
            catalog.fallbackFor(name).ifPresent(fallback -> {
                mapping.put(name, fallback);
                log.info("Mapped missing resource '{}' to fallback {}", name, fallback);
            });
        }
        return mapping;
    }

    /**
     * Names of the given descriptors that are missing, in input order.
     */
    public List<String> missing(List<ResourceDescriptor> descriptors) {
        var missing = new ArrayList<String>();
        for (ResourceDescriptor descriptor : descriptors) {
            if (!isAvailable(descriptor)) {
                missing.add(descriptor.name());
            }
        }
        return missing;
    }

    public boolean isAvailable(ResourceDescriptor descriptor) {
        var handle = environment.resolve(descriptor);
        if (handle.isEmpty()) {
            log.warn("Missing {} resource: {}", descriptor.kind().name().toLowerCase(), descriptor.name());
            return false;
        }
        try {
            environment.load(descriptor, handle.get());
            log.debug("Resource validated: {}", descriptor.name());
            return true;
        } catch (Exception e) {
            log.warn("Failed to load {} resource {}: {}",
                    descriptor.kind().name().toLowerCase(), descriptor.name(), e.getMessage());
            return false;
        }
    }

    private ValidationReport validate(List<ResourceDescriptor> descriptors, Set<String> namesWithFallback) {
        var missingByKind = new EnumMap<ResourceKind, List<String>>(ResourceKind.class);
        for (ResourceDescriptor descriptor : descriptors) {
            if (!isAvailable(descriptor)) {
                missingByKind.computeIfAbsent(descriptor.kind(), k -> new ArrayList<>()).add(descriptor.name());
            }
        }
        return ValidationReport.of(missingByKind, namesWithFallback, clock.instant());
    }
}
