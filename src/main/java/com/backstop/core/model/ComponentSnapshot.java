package com.backstop.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight live status of a component, kept by the ledger for status displays.
 */
public record ComponentSnapshot(
    String componentId,
    String state,
    Instant timestamp,
    Map<String, Object> details
) {}
