package com.backstop.core.recovery;

import java.util.Locale;

/**
 * Closed set of component kinds the fallback tables know about.
 */
public enum ComponentKind {
    TOGGLE_SWITCH("moderntoggleswitch", "toggleswitch", "toggle"),
    GLASS_CARD("glasscard"),
    GLASS_BACKGROUND("glassybackgroundview", "glassbackground"),
    GLASS_DIALOG("glassdialog"),
    SETTINGS_SCREEN("settingsfragment", "settingsscreen", "settings"),
    MENU_CONTAINER("glassmenucontainer", "menucontainer", "menu"),
    GENERIC();

    private final String[] aliases;

    ComponentKind(String... aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolves a component id such as {@code "ModernToggleSwitch"} or
     * {@code "glass-card#prefs"} to its kind. Case, {@code -} and {@code _} are ignored,
     * as is anything after {@code #}.
     */
    public static ComponentKind fromComponentId(String componentId) {
        if (componentId == null) {
            return GENERIC;
        }
        String base = componentId;
        int hash = base.indexOf('#');
        if (hash >= 0) {
            base = base.substring(0, hash);
        }
        String normalized = base.toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        for (ComponentKind kind : values()) {
            for (String alias : kind.aliases) {
                if (normalized.equals(alias)) {
                    return kind;
                }
            }
        }
        return GENERIC;
    }

    public boolean isGlass() {
        return this == GLASS_CARD || this == GLASS_BACKGROUND || this == GLASS_DIALOG || this == MENU_CONTAINER;
    }
}
