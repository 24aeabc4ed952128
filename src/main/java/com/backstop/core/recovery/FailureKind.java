package com.backstop.core.recovery;

/**
 * Retry taxonomy: what went wrong, as far as choosing a retry strategy is concerned.
 */
public enum FailureKind {
    /** The host refused a mutation because its state was already saved. */
    STATE_LOSS(RetryStrategy.RETRY_ALLOWING_STATE_LOSS),
    /** The component was not attached to the host yet. */
    NOT_ATTACHED(RetryStrategy.RETRY_AFTER_DELAY),
    LIFECYCLE_ERROR(RetryStrategy.FORCE_CLEANUP),
    ILLEGAL_STATE(RetryStrategy.RETRY_ALLOWING_STATE_LOSS),
    UNKNOWN(RetryStrategy.ABORT);

    private final RetryStrategy strategy;

    FailureKind(RetryStrategy strategy) {
        this.strategy = strategy;
    }

    public RetryStrategy strategy() {
        return strategy;
    }
}
