package com.backstop.core.health;

/**
 * System-wide tier derived from all component states.
 */
public enum SystemTier {
    NORMAL,
    DEGRADED,
    EMERGENCY,
    CRITICAL
}
