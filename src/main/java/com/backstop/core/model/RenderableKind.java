package com.backstop.core.model;

/**
 * What a {@link Renderable} handed back to the host actually is.
 */
public enum RenderableKind {
    /** Produced by the host's own retry callback. */
    LIVE,
    /** Substitute from the fallback table for a known component kind. */
    FALLBACK,
    /** Generic substitute for a tier with no specific mapping. */
    PLACEHOLDER,
    /** Plain text message; never mutates the UI tree. */
    STATUS_MESSAGE,
    /** Inert "unavailable" marker. */
    UNAVAILABLE
}
