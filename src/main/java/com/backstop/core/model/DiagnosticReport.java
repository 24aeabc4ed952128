package com.backstop.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Operator-facing snapshot of the diagnostic ledger.
 */
public record DiagnosticReport(
    String version,
    Instant timestamp,
    DeviceSnapshot device,
    CrashSummary summary,
    List<CrashRecord> recentRecords,
    List<ComponentSnapshot> componentStates,
    List<String> recommendations
) {}
