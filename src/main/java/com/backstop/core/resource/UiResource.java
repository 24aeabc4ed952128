package com.backstop.core.resource;

import com.backstop.core.model.ResourceDescriptor;
import com.backstop.core.model.ResourceKind;

import java.util.Optional;

/**
 * Resources the general settings UI and its custom components depend on.
 * Layouts are structural and have no fallback.
 */
public enum UiResource implements CatalogEntry {

    MODERN_TOGGLE_TRACK_ANIMATED("modern_toggle_track_animated", ResourceKind.VISUAL, "builtin:btn_default"),
    MODERN_TOGGLE_THUMB("modern_toggle_thumb", ResourceKind.VISUAL, "builtin:btn_default_small"),
    MODERN_TOGGLE_THUMB_FOCUSED("modern_toggle_thumb_focused", ResourceKind.VISUAL, "builtin:btn_default_small"),

    SETTING("setting", ResourceKind.LAYOUT, null),
    GLASS_CARD_PREFERENCES("glass_card_preferences", ResourceKind.LAYOUT, null),
    GLASS_CARD_CONFIGURATION("glass_card_configuration", ResourceKind.LAYOUT, null),
    GLASS_CARD_ACTIONS("glass_card_actions", ResourceKind.LAYOUT, null),

    FOCUS("focus", ResourceKind.COLOR, "#FF00DDFF"),
    GLASS_BORDER_FOCUSED("glass_border_focused", ResourceKind.COLOR, "#FFFFFFFF"),
    GLASS_CARD_BACKGROUND_FOCUSED("glass_card_background_focused", ResourceKind.COLOR, "#FFAAAAAA"),
    GLASS_BORDER("glass_border", ResourceKind.COLOR, "#FFAAAAAA"),
    GLASS_CARD_BACKGROUND("glass_card_background", ResourceKind.COLOR, "#FF101010"),
    GLASS_HIGHLIGHT_FOCUSED("glass_highlight_focused", ResourceKind.COLOR, "#FFFFFFFF"),
    INFO_TEXT_PRIMARY("info_text_primary", ResourceKind.COLOR, "#FFFFFFFF"),
    INFO_TEXT_SECONDARY("info_text_secondary", ResourceKind.COLOR, "#FFBEBEBE"),
    WHITE("white", ResourceKind.COLOR, "#FFFFFFFF"),

    TV_MIN_TOUCH_TARGET("tv_min_touch_target", ResourceKind.DIMENSION, "48dp"),
    TV_TEXT_SIZE_MEDIUM("tv_text_size_medium", ResourceKind.DIMENSION, "16dp"),
    TOGGLE_PADDING("toggle_padding", ResourceKind.DIMENSION, "8dp");

    public static final ResourceCatalog CATALOG = ResourceCatalog.of("ui", UiResource.class);

    private final ResourceDescriptor descriptor;
    private final String fallback;

    UiResource(String name, ResourceKind kind, String fallback) {
        this.descriptor = new ResourceDescriptor(name, kind);
        this.fallback = fallback;
    }

    @Override
    public ResourceDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public Optional<String> fallback() {
        return Optional.ofNullable(fallback);
    }
}
