package com.backstop.core.model;

/**
 * A named resource the UI expects to find in its environment.
 *
 * @param name resource name as the host knows it (e.g. "glass_border")
 * @param kind resource category
 */
public record ResourceDescriptor(
    String name,
    ResourceKind kind
) {}
