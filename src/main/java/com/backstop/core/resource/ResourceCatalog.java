package com.backstop.core.resource;

import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ResourceKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A fixed, named set of resource descriptors with their fallback table.
 */
public final class ResourceCatalog {

    private final String name;
    private final List<ResourceDescriptor> descriptors;
    private final Map<String, String> fallbacks;

    private ResourceCatalog(String name, List<ResourceDescriptor> descriptors, Map<String, String> fallbacks) {
        this.name = name;
        this.descriptors = List.copyOf(descriptors);
        this.fallbacks = Collections.unmodifiableMap(fallbacks);
    }

    /**
     * Builds a catalog from the constants of an enum of catalog entries.
     */
    public static <E extends Enum<E> & CatalogEntry> ResourceCatalog of(String name, Class<E> entries) {
        var descriptors = new ArrayList<ResourceDescriptor>();
        var fallbacks = new LinkedHashMap<String, String>();
        for (E entry : entries.getEnumConstants()) {
            descriptors.add(entry.descriptor());
            entry.fallback().ifPresent(f -> fallbacks.put(entry.descriptor().name(), f));
        }
        return new ResourceCatalog(name, descriptors, fallbacks);
    }

    public String name() {
        return name;
    }

    public List<ResourceDescriptor> descriptors() {
        return descriptors;
    }

    public List<ResourceDescriptor> descriptors(ResourceKind kind) {
        return descriptors.stream().filter(d -> d.kind() == kind).toList();
    }

    public Optional<String> fallbackFor(String resourceName) {
        return Optional.ofNullable(fallbacks.get(resourceName));
    }

    public Set<String> namesWithFallback() {
        return fallbacks.keySet();
    }

    public int size() {
        return descriptors.size();
    }
}
