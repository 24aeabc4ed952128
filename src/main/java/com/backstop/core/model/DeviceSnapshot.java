package com.backstop.core.model;

/**
 * Environment metadata captured for a crash record.
 */
public record DeviceSnapshot(
    String osName,
    String osVersion,
    String arch,
    String javaVersion,
    String javaVendor,
    int availableProcessors,
    long freeMemoryMb,
    long totalMemoryMb,
    long maxMemoryMb,
    boolean headless
) {

    /** Placeholder visible until enrichment fills in the real snapshot. */
    public static final DeviceSnapshot PENDING =
            new DeviceSnapshot("pending", "pending", "pending", "pending", "pending", 0, -1, -1, -1, true);

    public boolean isPending() {
        return this == PENDING;
    }
}
