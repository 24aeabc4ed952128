package com.backstop.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link MainThreadDispatcher} over a single daemon thread named {@code backstop-main}.
 */
public class ScheduledMainThreadDispatcher implements MainThreadDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledMainThreadDispatcher.class);

    private final ScheduledExecutorService executor;

    public ScheduledMainThreadDispatcher() {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "backstop-main");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void post(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public Cancellable postDelayed(Runnable task, Duration delay) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Dispatched task failed: {}", e.getMessage(), e);
            }
        };
    }
}
