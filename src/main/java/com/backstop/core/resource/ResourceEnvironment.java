package com.backstop.core.resource;

import com.backstop.core.model.ResourceDescriptor;

import java.util.Optional;

/**
 * Boundary to the live environment the UI resolves its resources from.
 * Implementations must be read-only and safe to call concurrently.
 */
public interface ResourceEnvironment {

    /**
     * Resolves a resource to an environment-specific handle (location, raw value).
     *
     * @return the handle, or empty when the environment has no such resource
     */
    Optional<String> resolve(ResourceDescriptor descriptor);

    /**
     * Loads a resolved resource.
     *
     * @param descriptor the resource
     * @param handle     the handle returned by {@link #resolve}
     * @return the loaded value
     * @throws Exception when the resource resolved but cannot be loaded
     */
    Object load(ResourceDescriptor descriptor, String handle) throws Exception;
}
