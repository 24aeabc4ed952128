package com.backstop.core.model;

/**
 * Progress of the background enrichment of a crash record.
 */
public enum EnrichmentStatus {
    PENDING,
    COMPLETE,
    FAILED
}
