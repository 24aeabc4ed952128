package com.backstop.core.model;

/**
 * Domain-independent bucket every degradation tier maps onto for health aggregation.
 */
public enum HealthBucket {
    NORMAL,
    DEGRADED,
    NEAR_FAILED,
    FAILED
}
