package com.backstop.core.glass;

/**
 * Effect configuration the host applies to glass surfaces.
 */
public record GlassStyle(
    boolean blurEnabled,
    boolean shadowsEnabled,
    boolean complexAnimations,
    float blurRadius,
    float backgroundAlpha,
    float borderAlpha
) {

    public static final GlassStyle DEFAULT = new GlassStyle(true, true, true, 25f, 0.2f, 0.3f);

    /**
     * Style for a tier, derived from {@link #DEFAULT}.
     */
    public static GlassStyle forTier(GlassTier tier) {
        return switch (tier) {
            case FULL -> DEFAULT;
            case REDUCED -> new GlassStyle(false, DEFAULT.shadowsEnabled, DEFAULT.complexAnimations,
                    0f, 0.8f, DEFAULT.borderAlpha);
            case MINIMAL -> new GlassStyle(false, false, false, 0f, 0.9f, 0.5f);
            case NONE -> new GlassStyle(false, false, false, 0f, 1.0f, 0f);
        };
    }
}
