package com.backstop.core.glass;

import com.backstop.core.model.Renderable;
import com.backstop.core.recovery.ComponentKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fallback table for glass components, keyed by (kind, glass tier). Every renderable
 * carries the {@link GlassStyle} of its tier as attributes.
 */
public final class GlassFallbackCatalog {

    public static final String EMERGENCY_TITLE = "Glass UI (Safe Mode)";
    public static final String EMERGENCY_MESSAGE =
            "Glass effects are disabled due to compatibility issues. Basic functionality is available.";

    private GlassFallbackCatalog() {}

    public static Renderable fallbackFor(String componentId, GlassTier tier) {
        ComponentKind kind = ComponentKind.fromComponentId(componentId);
        Map<String, String> style = styleAttributes(GlassStyle.forTier(tier));
        String tierName = tier.name();
        return switch (tier) {
            case FULL, REDUCED, MINIMAL -> switch (kind) {
                case GLASS_CARD -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        with(style, "orientation", "vertical", "padding", "12", "background", "darker_gray"));
                case GLASS_BACKGROUND -> Renderable.fallback(componentId, tierName, "View",
                        with(style, "background", "background_dark"));
                case GLASS_DIALOG -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        with(style, "orientation", "vertical", "padding", "16", "background", "background_dark"));
                case MENU_CONTAINER -> Renderable.fallback(componentId, tierName, "LinearLayout",
                        with(style, "orientation", "vertical", "background", "background_dark"));
                case TOGGLE_SWITCH, SETTINGS_SCREEN, GENERIC -> Renderable.placeholder(componentId, tierName);
            };
            case NONE -> switch (kind) {
                case GLASS_DIALOG, MENU_CONTAINER -> Renderable.fallback(componentId, tierName, EMERGENCY_TITLE,
                        with(style, "message", EMERGENCY_MESSAGE, "padding", "16", "background", "background_dark"));
                case GLASS_CARD, GLASS_BACKGROUND, TOGGLE_SWITCH, SETTINGS_SCREEN, GENERIC ->
                        Renderable.placeholder(componentId, tierName);
            };
        };
    }

    static Map<String, String> styleAttributes(GlassStyle style) {
        var attributes = new LinkedHashMap<String, String>();
        attributes.put("blur", String.valueOf(style.blurEnabled()));
        attributes.put("shadows", String.valueOf(style.shadowsEnabled()));
        attributes.put("blurRadius", String.valueOf(style.blurRadius()));
        attributes.put("backgroundAlpha", String.valueOf(style.backgroundAlpha()));
        attributes.put("borderAlpha", String.valueOf(style.borderAlpha()));
        return attributes;
    }

    private static Map<String, String> with(Map<String, String> base, String... keyValues) {
        var merged = new LinkedHashMap<>(base);
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            merged.put(keyValues[i], keyValues[i + 1]);
        }
        return merged;
    }
}
