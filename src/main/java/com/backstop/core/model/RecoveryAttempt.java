package com.backstop.core.model;

import java.time.Instant;

/**
 * One recovery attempt made against a crash record.
 *
 * @param strategy  strategy name (e.g. "RETRY_AFTER_DELAY", "FALLBACK_EMERGENCY")
 * @param success   whether the attempt produced a usable result
 * @param detail    optional detail, usually the error of a failed attempt
 * @param timestamp when the attempt finished
 */
public record RecoveryAttempt(
    String strategy,
    boolean success,
    String detail,
    Instant timestamp
) {}
