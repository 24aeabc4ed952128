package com.backstop.core.model;

/**
 * What the host should do after a resource validation pass.
 */
public enum RecommendedAction {
    /** Everything resolved. */
    PROCEED_NORMAL,
    /** Something is missing but every missing resource has a fallback. */
    USE_FALLBACK_UI,
    /** Structural (layout) resources are missing. */
    USE_EMERGENCY_UI,
    ABORT
}
