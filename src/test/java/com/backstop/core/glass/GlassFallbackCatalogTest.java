package com.backstop.core.glass;

import com.backstop.core.model.RenderableKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GlassFallbackCatalogTest {

    @Test
    @DisplayName("Every kind and tier yields a renderable")
    void total() {
        for (String id : new String[]{"GlassCard", "GlassyBackgroundView", "GlassDialog", "GlassMenuContainer",
                "ModernToggleSwitch", "Unknown"}) {
            for (GlassTier tier : GlassTier.values()) {
                var renderable = GlassFallbackCatalog.fallbackFor(id, tier);
                assertNotNull(renderable, id + " at " + tier);
                assertEquals(tier.name(), renderable.tier());
            }
        }
    }

    @Test
    @DisplayName("Reduced card carries the reduced style")
    void reducedCardStyle() {
        var card = GlassFallbackCatalog.fallbackFor("GlassCard", GlassTier.REDUCED);

        assertEquals(RenderableKind.FALLBACK, card.kind());
        assertEquals("false", card.attributes().get("blur"));
        assertEquals("0.8", card.attributes().get("backgroundAlpha"));
    }

    @Test
    @DisplayName("Dialog at NONE shows the safe-mode message")
    void safeModeDialog() {
        var dialog = GlassFallbackCatalog.fallbackFor("GlassDialog", GlassTier.NONE);

        assertEquals(GlassFallbackCatalog.EMERGENCY_TITLE, dialog.label());
        assertEquals(GlassFallbackCatalog.EMERGENCY_MESSAGE, dialog.attributes().get("message"));
    }

    @Test
    @DisplayName("Card at NONE is a placeholder")
    void cardAtNone() {
        assertEquals(RenderableKind.PLACEHOLDER, GlassFallbackCatalog.fallbackFor("GlassCard", GlassTier.NONE).kind());
    }
}
