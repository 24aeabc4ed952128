package com.backstop.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of a single resource validation pass. Immutable.
 *
 * @param missingByKind      names of missing resources grouped by kind (every kind present, possibly empty)
 * @param fallbacksAvailable how many of the missing resources have a fallback mapping
 * @param allAvailable       true when nothing is missing
 * @param recommendedAction  action derived from the missing set
 * @param timestamp          when the pass ran
 */
public record ValidationReport(
    Map<ResourceKind, List<String>> missingByKind,
    int fallbacksAvailable,
    boolean allAvailable,
    RecommendedAction recommendedAction,
    Instant timestamp
) {

    public ValidationReport {
        var copy = new EnumMap<ResourceKind, List<String>>(ResourceKind.class);
        copy.putAll(missingByKind);
        missingByKind = Collections.unmodifiableMap(copy);
    }

    /**
     * Builds a report from the missing names, deriving {@code allAvailable} and
     * {@code recommendedAction}.
     *
     * @param missingByKind    missing names per kind
     * @param namesWithFallback names that have a fallback mapping
     * @param timestamp        time of the validation pass
     */
    public static ValidationReport of(Map<ResourceKind, List<String>> missingByKind,
                                      Set<String> namesWithFallback,
                                      Instant timestamp) {
        var normalized = new EnumMap<ResourceKind, List<String>>(ResourceKind.class);
        for (ResourceKind kind : ResourceKind.values()) {
            normalized.put(kind, List.copyOf(missingByKind.getOrDefault(kind, List.of())));
        }

        int missingCount = 0;
        int fallbacks = 0;
        for (List<String> names : normalized.values()) {
            missingCount += names.size();
            for (String name : names) {
                if (namesWithFallback.contains(name)) {
                    fallbacks++;
                }
            }
        }

        RecommendedAction action;
        if (missingCount == 0) {
            action = RecommendedAction.PROCEED_NORMAL;
        } else if (fallbacks == missingCount) {
            action = RecommendedAction.USE_FALLBACK_UI;
        } else if (!normalized.get(ResourceKind.LAYOUT).isEmpty()) {
            action = RecommendedAction.USE_EMERGENCY_UI;
        } else {
            action = RecommendedAction.ABORT;
        }

        return new ValidationReport(normalized, fallbacks, missingCount == 0, action, timestamp);
    }

    public List<String> missing(ResourceKind kind) {
        return missingByKind.getOrDefault(kind, List.of());
    }

    public List<String> allMissing() {
        var all = new ArrayList<String>();
        missingByKind.values().forEach(all::addAll);
        return all;
    }

    public int missingCount() {
        return missingByKind.values().stream().mapToInt(List::size).sum();
    }
}
