package com.backstop.core.diagnostics;

import com.backstop.core.model.DeviceSnapshot;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;

/**
 * Captures the runtime environment for crash records and reports.
 */
@Component
public class DeviceSnapshotCollector {

    private static final long MB = 1024L * 1024L;

    public DeviceSnapshot collect() {
        Runtime runtime = Runtime.getRuntime();
        return new DeviceSnapshot(
                System.getProperty("os.name", "unknown"),
                System.getProperty("os.version", "unknown"),
                System.getProperty("os.arch", "unknown"),
                System.getProperty("java.version", "unknown"),
                System.getProperty("java.vendor", "unknown"),
                runtime.availableProcessors(),
                runtime.freeMemory() / MB,
                runtime.totalMemory() / MB,
                runtime.maxMemory() / MB,
                GraphicsEnvironment.isHeadless());
    }
}
