package com.backstop.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted by the engine, consumed by the engine facade and the operator surfaces.
 *
 * @param eventType   event type (e.g. "component.degraded", "component.recovered", "system.tier.changed")
 * @param componentId the component this event belongs to (nullable for system-level events)
 * @param payload     arbitrary key-value data associated with the event
 * @param timestamp   when the event occurred
 */
public record BackstopEvent(
    String eventType,
    String componentId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String COMPONENT_DEGRADED = "component.degraded";
    public static final String COMPONENT_RECOVERED = "component.recovered";
    public static final String SYSTEM_TIER_CHANGED = "system.tier.changed";
    public static final String SYSTEM_RECOVERY = "system.recovery";

    public static BackstopEvent of(String eventType, String componentId, Map<String, Object> payload) {
        return new BackstopEvent(eventType, componentId, payload, Instant.now());
    }
}
