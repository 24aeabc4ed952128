package com.backstop.core.diagnostics;

import com.backstop.core.model.CrashClassification;
import com.backstop.core.recovery.FailureKind;
import com.backstop.core.resource.ResourceNotFoundException;
import org.springframework.stereotype.Component;

import java.io.FileNotFoundException;
import java.util.List;
import java.util.Locale;
import java.util.MissingResourceException;

/**
 * Maps errors onto the two failure taxonomies: {@link CrashClassification} for the
 * diagnostic ledger and {@link FailureKind} for choosing a retry strategy.
 */
@Component
public class FailureClassifier {

    private static final List<String> LIFECYCLE_TERMS = List.of("fragment", "lifecycle", "destroyed", "detached");
    private static final List<String> COMPONENT_TERMS = List.of("view", "component", "render");

    private final DiagnosticsProperties properties;

    public FailureClassifier(DiagnosticsProperties properties) {
        this.properties = properties;
    }

    public CrashClassification classifyCrash(Throwable error, String context) {
        if (error instanceof ResourceNotFoundException
                || error instanceof MissingResourceException
                || error instanceof FileNotFoundException) {
            return CrashClassification.RESOURCE_NOT_FOUND;
        }
        String message = lower(error.getMessage());
        if (containsAny(message, LIFECYCLE_TERMS)) {
            return CrashClassification.LIFECYCLE_ERROR;
        }
        if (containsAny(message, COMPONENT_TERMS)) {
            return CrashClassification.CUSTOM_COMPONENT_FAILURE;
        }
        if (error instanceof OutOfMemoryError) {
            return CrashClassification.MEMORY_ERROR;
        }
        String where = lower(context);
        for (String area : properties.getFeatureAreas()) {
            String term = area.toLowerCase(Locale.ROOT);
            if (where.contains(term) || message.contains(term)) {
                return CrashClassification.DOMAIN_SPECIFIC_ERROR;
            }
        }
        return CrashClassification.UNKNOWN;
    }

    public FailureKind classifyKind(Throwable error) {
        String message = lower(error.getMessage());
        if (message.contains("state loss") || message.contains("state saved")) {
            return FailureKind.STATE_LOSS;
        }
        if (message.contains("not attached")) {
            return FailureKind.NOT_ATTACHED;
        }
        if (message.contains("destroyed")) {
            return FailureKind.LIFECYCLE_ERROR;
        }
        if (error instanceof IllegalStateException) {
            return FailureKind.ILLEGAL_STATE;
        }
        return FailureKind.UNKNOWN;
    }

    private static boolean containsAny(String text, List<String> terms) {
        return terms.stream().anyMatch(text::contains);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
