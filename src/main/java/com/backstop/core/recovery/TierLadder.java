package com.backstop.core.recovery;

import com.backstop.core.model.DegradationTier;

/**
 * Ordered view over a tier enum: one step down at a time, never past the bottom.
 */
public final class TierLadder<T extends Enum<T> & DegradationTier> {

    private final T[] tiers;

    public TierLadder(Class<T> tierType) {
        this.tiers = tierType.getEnumConstants();
    }

    public T top() {
        return tiers[0];
    }

    public T bottom() {
        return tiers[tiers.length - 1];
    }

    /**
     * The next lower tier; the bottom tier degrades to itself.
     */
    public T degrade(T tier) {
        return isBottom(tier) ? tier : tiers[tier.ordinal() + 1];
    }

    public boolean isBottom(T tier) {
        return tier.ordinal() == tiers.length - 1;
    }

    /**
     * True when {@code candidate} has more capability than {@code current}.
     */
    public boolean better(T candidate, T current) {
        return candidate.ordinal() < current.ordinal();
    }
}
