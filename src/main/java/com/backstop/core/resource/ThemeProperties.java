package com.backstop.core.resource;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Theme the {@link ThemeResourceEnvironment} resolves resources against.
 * <p>
 * Visual and layout resources are files found through a location pattern where
 * {@code {name}} is replaced by the resource name. Colors and dimensions are
 * configured by value; their keys use {@code -} where resource names use {@code _}
 * (e.g. {@code glass-border} for {@code glass_border}).
 */
@Component
@ConfigurationProperties(prefix = "backstop.theme")
public class ThemeProperties {

    private boolean advancedEffects = true;
    private String visualLocation = "classpath:theme/visual/{name}.xml";
    private String layoutLocation = "classpath:theme/layout/{name}.xml";
    private Map<String, String> colors = new LinkedHashMap<>();
    private Map<String, String> dimensions = new LinkedHashMap<>();

    public boolean isAdvancedEffects() { return advancedEffects; }
    public void setAdvancedEffects(boolean advancedEffects) { this.advancedEffects = advancedEffects; }
    public String getVisualLocation() { return visualLocation; }
    public void setVisualLocation(String visualLocation) { this.visualLocation = visualLocation; }
    public String getLayoutLocation() { return layoutLocation; }
    public void setLayoutLocation(String layoutLocation) { this.layoutLocation = layoutLocation; }
    public Map<String, String> getColors() { return colors; }
    public void setColors(Map<String, String> colors) { this.colors = colors; }
    public Map<String, String> getDimensions() { return dimensions; }
    public void setDimensions(Map<String, String> dimensions) { this.dimensions = dimensions; }
}
