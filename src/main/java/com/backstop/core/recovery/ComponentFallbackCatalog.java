package com.backstop.core.recovery;

import com.backstop.core.model.Renderable;

import java.util.Map;

/**
 * Deterministic fallback table for generic components, keyed by (kind, tier).
 */
public final class ComponentFallbackCatalog {

    private ComponentFallbackCatalog() {}

    public static Renderable fallbackFor(String componentId, ComponentTier tier) {
        ComponentKind kind = ComponentKind.fromComponentId(componentId);
        String tierName = tier.name();
        return switch (kind) {
            case TOGGLE_SWITCH -> switch (tier) {
                case NORMAL, REDUCED -> Renderable.fallback(componentId, tierName, "Switch",
                        Map.of("padding", "8", "focusable", "true"));
                case FALLBACK -> Renderable.fallback(componentId, tierName, "Switch",
                        Map.of("padding", "8"));
                case EMERGENCY -> Renderable.fallback(componentId, tierName, "Switch", Map.of());
                case FAILED -> Renderable.placeholder(componentId, tierName);
            };
            case GLASS_CARD -> switch (tier) {
                case NORMAL, REDUCED -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        Map.of("orientation", "vertical", "padding", "16", "background", "darker_gray"));
                case FALLBACK -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        Map.of("orientation", "vertical", "padding", "16"));
                case EMERGENCY -> Renderable.fallback(componentId, tierName, "LinearLayout", Map.of());
                case FAILED -> Renderable.placeholder(componentId, tierName);
            };
            case GLASS_BACKGROUND -> switch (tier) {
                case NORMAL, REDUCED, FALLBACK -> Renderable.fallback(componentId, tierName, "View",
                        Map.of("background", "background_dark", "alpha", "0.8"));
                case EMERGENCY, FAILED -> Renderable.placeholder(componentId, tierName);
            };
            case GLASS_DIALOG -> switch (tier) {
                case NORMAL, REDUCED, FALLBACK -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        Map.of("orientation", "vertical", "padding", "16", "background", "background_dark"));
                case EMERGENCY, FAILED -> Renderable.placeholder(componentId, tierName);
            };
            case SETTINGS_SCREEN -> switch (tier) {
                case NORMAL, REDUCED, FALLBACK -> Renderable.fallback(componentId, tierName, "Settings",
                        Map.of("mode", "standard", "padding", "16"));
                case EMERGENCY -> Renderable.fallback(componentId, tierName,
                        "Settings unavailable. Press BACK to return.",
                        Map.of("mode", "safe", "padding", "32", "textSize", "16"));
                case FAILED -> Renderable.placeholder(componentId, tierName);
            };
            case MENU_CONTAINER -> switch (tier) {
                case NORMAL, REDUCED, FALLBACK -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        Map.of("orientation", "vertical", "background", "background_dark"));
                case EMERGENCY, FAILED -> Renderable.placeholder(componentId, tierName);
            };
            case GENERIC -> Renderable.placeholder(componentId, tierName);
        };
    }
}
