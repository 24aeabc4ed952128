package com.backstop.core.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable view of a failure recorded in the diagnostic ledger.
 *
 * @param id               ledger id ("crash_&lt;millis&gt;_&lt;suffix&gt;")
 * @param timestamp        when the failure was recorded
 * @param classification   crash taxonomy bucket
 * @param errorType        simple class name of the error
 * @param message          error message, "No message" when absent
 * @param stackSummary     first frames of the stack trace
 * @param context          call-site context (e.g. "component.onFailure")
 * @param componentId      component the failure belongs to (nullable)
 * @param deviceSnapshot   environment metadata, {@link DeviceSnapshot#PENDING} until enriched
 * @param resourceSnapshot resource validation at failure time (nullable until enriched)
 * @param recoveryAttempts attempts recorded against this failure, oldest first
 * @param enrichment       enrichment progress
 */
public record CrashRecord(
    String id,
    Instant timestamp,
    CrashClassification classification,
    String errorType,
    String message,
    String stackSummary,
    String context,
    String componentId,
    DeviceSnapshot deviceSnapshot,
    ValidationReport resourceSnapshot,
    List<RecoveryAttempt> recoveryAttempts,
    EnrichmentStatus enrichment
) {

    public boolean recovered() {
        return recoveryAttempts.stream().anyMatch(RecoveryAttempt::success);
    }
}
