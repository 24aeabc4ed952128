package com.backstop.core.recovery;

public enum RetryStrategy {
    /** Retry immediately; the result is committed in lossy mode. */
    RETRY_ALLOWING_STATE_LOSS,
    /** Retry later on the main dispatcher; the fallback is used meanwhile. */
    RETRY_AFTER_DELAY,
    /** Cancel pending retries and ask the host to clean up, then fall back. */
    FORCE_CLEANUP,
    /** No retry. */
    ABORT
}
