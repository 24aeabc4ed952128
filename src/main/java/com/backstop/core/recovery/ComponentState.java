package com.backstop.core.recovery;

import com.backstop.core.model.DegradationTier;

import java.time.Instant;

/**
 * Immutable snapshot of one component's recovery state.
 *
 * @param componentId component the state belongs to
 * @param tier        current tier
 * @param lastError   message of the last failure, null when none
 * @param retryCount  failures since the last explicit recovery
 * @param timestamp   when the state was last changed
 * @param recoverable false once the component sits at the bottom tier
 */
public record ComponentState<T extends Enum<T> & DegradationTier>(
    String componentId,
    T tier,
    String lastError,
    int retryCount,
    Instant timestamp,
    boolean recoverable
) {

    static <T extends Enum<T> & DegradationTier> ComponentState<T> initial(String componentId, TierLadder<T> ladder,
                                                                          Instant now) {
        return new ComponentState<>(componentId, ladder.top(), null, 0, now, true);
    }

    ComponentState<T> withTier(T newTier, String error, int count, TierLadder<T> ladder, Instant now) {
        return new ComponentState<>(componentId, newTier, error, count, now, !ladder.isBottom(newTier));
    }
}
