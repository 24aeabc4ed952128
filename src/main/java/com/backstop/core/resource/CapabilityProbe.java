package com.backstop.core.resource;

/**
 * Reports whether the platform supports advanced rendering effects (blur, translucency).
 */
@FunctionalInterface
public interface CapabilityProbe {

    boolean supportsAdvancedEffects();
}
