package com.backstop.core.model;

/**
 * Category of a named UI resource.
 */
public enum ResourceKind {
    VISUAL,
    LAYOUT,
    COLOR,
    DIMENSION
}
