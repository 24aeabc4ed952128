package com.backstop.core.transaction;

/**
 * The host application's view of its own lifecycle.
 */
public interface HostEnvironment {

    EnvironmentState environmentState();

    /**
     * Releases whatever the host holds for {@code componentId} after a lifecycle failure.
     */
    default void forceCleanup(String componentId) {
    }
}
