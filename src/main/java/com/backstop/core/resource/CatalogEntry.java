package com.backstop.core.resource;

import com.backstop.core.model.ResourceDescriptor;

import java.util.Optional;

/**
 * Implemented by the enum constants that make up a resource catalog. Each constant
 * declares its own fallback, so the fallback table cannot drift from the catalog.
 */
public interface CatalogEntry {

    ResourceDescriptor descriptor();

    /** Substitute value for the resource, empty for structural resources that have none. */
    Optional<String> fallback();
}
