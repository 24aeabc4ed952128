package com.backstop.core.resource;

import org.springframework.stereotype.Component;

/**
 * Capability probe driven by {@code backstop.theme.advanced-effects}; the host sets it
 * from what its renderer reports at startup.
 */
@Component
public class ThemeCapabilityProbe implements CapabilityProbe {

    private final ThemeProperties theme;

    public ThemeCapabilityProbe(ThemeProperties theme) {
        this.theme = theme;
    }

    @Override
    public boolean supportsAdvancedEffects() {
        return theme.isAdvancedEffects();
    }
}
