package com.backstop.core.model;

import java.util.Map;

/**
 * Aggregate view over the records retained by the ledger.
 *
 * @param totalCrashes            records currently retained
 * @param recentCrashes           records included in the report
 * @param countsByClassification  retained records per classification
 * @param mostCommonClassification dominant classification, null when empty
 * @param averageRecoveryAttempts mean attempts per retained record
 * @param successfulRecoveries    retained records with at least one successful attempt
 */
public record CrashSummary(
    int totalCrashes,
    int recentCrashes,
    Map<CrashClassification, Long> countsByClassification,
    CrashClassification mostCommonClassification,
    double averageRecoveryAttempts,
    int successfulRecoveries
) {}
