package com.backstop.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Representation of a UI element handed back to the host. The host maps it onto real
 * widgets; the engine only decides which one.
 *
 * @param componentId component this representation stands in for
 * @param kind        what kind of representation this is
 * @param tier        tier name the representation was produced for
 * @param label       widget type or message text
 * @param mutatesTree true when applying it requires a structural UI mutation
 * @param attributes  styling hints (padding, background, alpha, commit mode)
 */
public record Renderable(
    String componentId,
    RenderableKind kind,
    String tier,
    String label,
    boolean mutatesTree,
    Map<String, String> attributes
) {

    public static final String COMMIT_MODE = "commitMode";
    public static final String COMMIT_LOSSY = "LOSSY";

    public Renderable {
        attributes = Map.copyOf(attributes);
    }

    public static Renderable live(String componentId, String label, Map<String, String> attributes) {
        return new Renderable(componentId, RenderableKind.LIVE, "LIVE", label, true, attributes);
    }

    public static Renderable fallback(String componentId, String tier, String label, Map<String, String> attributes) {
        return new Renderable(componentId, RenderableKind.FALLBACK, tier, label, true, attributes);
    }

    public static Renderable placeholder(String componentId, String tier) {
        return new Renderable(componentId, RenderableKind.PLACEHOLDER, tier, "Component unavailable", true,
                Map.of("padding", "8", "textColor", "secondary_text"));
    }

    public static Renderable statusMessage(String componentId, String message) {
        return new Renderable(componentId, RenderableKind.STATUS_MESSAGE, "NONE", message, false, Map.of());
    }

    public static Renderable unavailable(String componentId) {
        return new Renderable(componentId, RenderableKind.UNAVAILABLE, "NONE", "Unavailable", false, Map.of());
    }

    public Renderable withAttribute(String key, String value) {
        var merged = new LinkedHashMap<>(attributes);
        merged.put(key, value);
        return new Renderable(componentId, kind, tier, label, mutatesTree, merged);
    }

    public boolean lossyCommit() {
        return COMMIT_LOSSY.equals(attributes.get(COMMIT_MODE));
    }
}
