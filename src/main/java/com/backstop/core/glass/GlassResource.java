package com.backstop.core.glass;

import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ResourceKind;
import com.backstop.core.resource.CatalogEntry;
import com.backstop.core.resource.ResourceCatalog;

import java.util.Optional;

/**
 * Resources of the glass effects subsystem. Every entry carries its fallback.
 */
public enum GlassResource implements CatalogEntry {

    GLASS_MENU_BACKGROUND("glass_menu_background", ResourceKind.VISUAL, "builtin:menu_panel_bg"),
    GLASS_PANEL_BACKGROUND("glass_panel_background", ResourceKind.VISUAL, "builtin:tv_panel_bg"),
    GLASS_ITEM_BACKGROUND("glass_item_background", ResourceKind.VISUAL, "builtin:list_item_bg"),
    GLASS_ITEM_FOCUSED("glass_item_focused", ResourceKind.VISUAL, "builtin:focus_background"),
    GLASS_ITEM_MOVING("glass_item_moving", ResourceKind.VISUAL, "builtin:focus_background"),
    GLASS_CARD_BACKGROUND("glass_card_background", ResourceKind.VISUAL, "builtin:simple_card_background"),
    GLASS_CARD_FOCUSED("glass_card_focused", ResourceKind.VISUAL, "builtin:focus_background"),
    GLASS_CARD_SELECTOR("glass_card_selector", ResourceKind.VISUAL, "builtin:focus_background"),
    GLASSMORPHISM_OVERLAY("glassmorphism_overlay", ResourceKind.VISUAL, "builtin:screen_background_dark_transparent"),
    BLUR_BACKGROUND("blur_background", ResourceKind.VISUAL, "builtin:screen_background_dark"),

    GLASS_BACKGROUND("glass_background", ResourceKind.COLOR, "#CC000000"),
    GLASS_BACKGROUND_FOCUSED("glass_background_focused", ResourceKind.COLOR, "#E6202020"),
    GLASS_BORDER("glass_border", ResourceKind.COLOR, "#FFAAAAAA"),
    GLASS_BORDER_FOCUSED("glass_border_focused", ResourceKind.COLOR, "#FFFFFFFF"),
    GLASS_TEXT_PRIMARY("glass_text_primary", ResourceKind.COLOR, "#FFFFFFFF"),
    GLASS_TEXT_SECONDARY("glass_text_secondary", ResourceKind.COLOR, "#FFBEBEBE"),
    GLASS_HIGHLIGHT("glass_highlight", ResourceKind.COLOR, "#FF33B5E5"),
    GLASS_HIGHLIGHT_FOCUSED("glass_highlight_focused", ResourceKind.COLOR, "#FFFFFFFF"),
    GLASS_SHADOW("glass_shadow", ResourceKind.COLOR, "#80000000"),

    GLASS_CORNER_RADIUS("glass_corner_radius", ResourceKind.DIMENSION, "8dp"),
    GLASS_ELEVATION("glass_elevation", ResourceKind.DIMENSION, "4dp"),
    GLASS_BLUR_RADIUS("glass_blur_radius", ResourceKind.DIMENSION, "25dp"),
    GLASS_BORDER_WIDTH("glass_border_width", ResourceKind.DIMENSION, "1dp"),
    GLASS_CARD_PADDING("glass_card_padding", ResourceKind.DIMENSION, "16dp"),
    GLASS_CARD_MARGIN("glass_card_margin", ResourceKind.DIMENSION, "8dp"),
    GLASS_CARD_ELEVATION("glass_card_elevation", ResourceKind.DIMENSION, "6dp"),
    GLASS_TEXT_SIZE_LARGE("glass_text_size_large", ResourceKind.DIMENSION, "20dp"),
    GLASS_TEXT_SIZE_MEDIUM("glass_text_size_medium", ResourceKind.DIMENSION, "16dp"),
    GLASS_TEXT_SIZE_SMALL("glass_text_size_small", ResourceKind.DIMENSION, "14dp"),
    GLASS_TEXT_SIZE_CAPTION("glass_text_size_caption", ResourceKind.DIMENSION, "12dp");

    public static final ResourceCatalog CATALOG = ResourceCatalog.of("glass", GlassResource.class);

    private final ResourceDescriptor descriptor;
    private final String fallback;

    GlassResource(String name, ResourceKind kind, String fallback) {
        this.descriptor = new ResourceDescriptor(name, kind);
        this.fallback = fallback;
    }

    @Override
    public ResourceDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Optional<String> fallback() {
        return Optional.of(fallback);
    }
}
