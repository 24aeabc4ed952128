package com.backstop.core.model;

/**
 * Closed taxonomy used by the diagnostic ledger to classify failures.
 */
public enum CrashClassification {
    RESOURCE_NOT_FOUND,
    /** Host scope torn down mid-operation. */
    LIFECYCLE_ERROR,
    /** A specific renderable failed to construct. */
    CUSTOM_COMPONENT_FAILURE,
    MEMORY_ERROR,
    /** Failure tied to a named feature area such as "settings". */
    DOMAIN_SPECIFIC_ERROR,
    UNKNOWN
}
