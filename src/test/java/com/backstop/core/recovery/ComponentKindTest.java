package com.backstop.core.recovery;

import com.backstop.core.model.RenderableKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ComponentKindTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "ModernToggleSwitch, TOGGLE_SWITCH",
            "toggle, TOGGLE_SWITCH",
            "glass-card#prefs, GLASS_CARD",
            "GlassyBackgroundView, GLASS_BACKGROUND",
            "SETTINGS_FRAGMENT, SETTINGS_SCREEN",
            "GlassMenuContainer, MENU_CONTAINER",
            "VideoPlayer, GENERIC"
    })
    void resolves(String componentId, ComponentKind expected) {
        assertEquals(expected, ComponentKind.fromComponentId(componentId));
    }

    @Test
    @DisplayName("Null id is GENERIC")
    void nullId() {
        assertEquals(ComponentKind.GENERIC, ComponentKind.fromComponentId(null));
    }

    @Test
    @DisplayName("Every kind and tier has a fallback; unknown kinds get a placeholder")
    void fallbackTableIsTotal() {
        for (String id : new String[]{"ModernToggleSwitch", "GlassCard", "GlassyBackgroundView", "GlassDialog",
                "SettingsFragment", "GlassMenuContainer", "VideoPlayer"}) {
            for (ComponentTier tier : ComponentTier.values()) {
                assertNotNull(ComponentFallbackCatalog.fallbackFor(id, tier), id + " at " + tier);
            }
        }
        assertEquals(RenderableKind.PLACEHOLDER,
                ComponentFallbackCatalog.fallbackFor("VideoPlayer", ComponentTier.REDUCED).kind());
        assertEquals(RenderableKind.PLACEHOLDER,
                ComponentFallbackCatalog.fallbackFor("ModernToggleSwitch", ComponentTier.FAILED).kind());
    }
}
