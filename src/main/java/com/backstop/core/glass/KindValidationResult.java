package com.backstop.core.glass;

import com.backstop.core.model.ResourceKind;

import java.util.List;

/**
 * Validation outcome for one resource kind of a domain catalog.
 */
public record KindValidationResult(
    ResourceKind kind,
    int total,
    List<String> missing,
    int fallbacksAvailable
) {

    public KindValidationResult {
        missing = List.copyOf(missing);
    }

    public int available() {
        return total - missing.size();
    }

    public double availabilityPercentage() {
        return total == 0 ? 100.0 : available() * 100.0 / total;
    }
}
