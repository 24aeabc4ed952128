package com.backstop.core.scheduler;

import java.time.Duration;

/**
 * Single logical thread on which deferred UI work runs.
 */
public interface MainThreadDispatcher {

    void post(Runnable task);

    /**
     * Runs {@code task} after {@code delay}.
     *
     * @return handle that prevents the task from running if it has not started yet
     */
    Cancellable postDelayed(Runnable task, Duration delay);

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
