package com.backstop.core.resource;

import com.backstop.core.model.ResourceDescriptor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link ResourceEnvironment} backed by the configured {@link ThemeProperties}.
 * <p>
 * Visuals and layouts resolve when their file exists and load when it is non-empty.
 * Colors load when they parse as {@code #RRGGBB} or {@code #AARRGGBB}; dimensions
 * when they parse as a number with a {@code dp}, {@code sp} or {@code px} unit.
 */
@Component
public class ThemeResourceEnvironment implements ResourceEnvironment {

    private static final Pattern COLOR = Pattern.compile("#([0-9a-fA-F]{6}|[0-9a-fA-F]{8})");
    private static final Pattern DIMENSION = Pattern.compile("(\\d+(?:\\.\\d+)?)(dp|sp|px)");

    private final ThemeProperties theme;
    private final ResourceLoader resourceLoader;

    public ThemeResourceEnvironment(ThemeProperties theme, ResourceLoader resourceLoader) {
        this.theme = theme;
        this.resourceLoader = resourceLoader;
    }

    @Override
    public Optional<String> resolve(ResourceDescriptor descriptor) {
        return switch (descriptor.kind()) {
            case VISUAL -> locate(theme.getVisualLocation(), descriptor.name());
            case LAYOUT -> locate(theme.getLayoutLocation(), descriptor.name());
            case COLOR -> lookup(theme.getColors(), descriptor.name());
            case DIMENSION -> lookup(theme.getDimensions(), descriptor.name());
        };
    }

    @Override
    public Object load(ResourceDescriptor descriptor, String handle) throws Exception {
        return switch (descriptor.kind()) {
            case VISUAL, LAYOUT -> readFile(descriptor.name(), handle);
            case COLOR -> parseColor(descriptor.name(), handle);
            case DIMENSION -> parseDimension(descriptor.name(), handle);
        };
    }

    static long parseColor(String name, String value) {
        var matcher = COLOR.matcher(value.trim());
        if (!matcher.matches()) {
            throw new ResourceNotFoundException(name, "Invalid color value for " + name + ": " + value);
        }
        String hex = matcher.group(1);
        return Long.parseLong(hex.length() == 6 ? "FF" + hex : hex, 16);
    }

    static float parseDimension(String name, String value) {
        var matcher = DIMENSION.matcher(value.trim());
        if (!matcher.matches()) {
            throw new ResourceNotFoundException(name, "Invalid dimension value for " + name + ": " + value);
        }
        return Float.parseFloat(matcher.group(1));
    }

    private Optional<String> locate(String pattern, String name) {
        String location = pattern.replace("{name}", name);
        Resource resource = resourceLoader.getResource(location);
        return resource.exists() ? Optional.of(location) : Optional.empty();
    }

    private static Optional<String> lookup(Map<String, String> values, String name) {
        String value = values.get(name.replace('_', '-'));
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private byte[] readFile(String name, String location) throws Exception {
        try (InputStream in = resourceLoader.getResource(location).getInputStream()) {
            byte[] content = in.readAllBytes();
            if (content.length == 0) {
                throw new ResourceNotFoundException(name, "Resource file is empty: " + location);
            }
            return content;
        }
    }
}
