package com.backstop.core.model;

/**
 * Implemented by the ordered tier enums of each recovery domain.
 * Declaration order is capability order: the first constant is full capability,
 * the last is the terminal tier.
 */
public interface DegradationTier {

    HealthBucket bucket();
}
