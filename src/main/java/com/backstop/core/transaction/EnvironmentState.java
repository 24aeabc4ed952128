package com.backstop.core.transaction;

/**
 * What the host reports about its ability to accept structural UI mutations.
 *
 * @param hostFinishing            the host scope is finishing
 * @param hostDestroyed            the host scope is destroyed
 * @param mutationManagerDestroyed the component that applies mutations is gone
 * @param stateSaved               the host already saved its state; mutations would be lost on restore
 */
public record EnvironmentState(
    boolean hostFinishing,
    boolean hostDestroyed,
    boolean mutationManagerDestroyed,
    boolean stateSaved
) {

    public static final EnvironmentState ACTIVE = new EnvironmentState(false, false, false, false);
}
