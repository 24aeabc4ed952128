package com.backstop.core.scheduler;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledMainThreadDispatcherTest {

    private final ScheduledMainThreadDispatcher dispatcher = new ScheduledMainThreadDispatcher();

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    @Test
    @DisplayName("Tasks run on the backstop-main thread")
    void runsOnMainThread() throws InterruptedException {
        var latch = new CountDownLatch(1);
        var thread = new AtomicReference<String>();

        dispatcher.post(() -> {
            thread.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertEquals("backstop-main", thread.get());
    }

    @Test
    @DisplayName("A failing task does not stop later tasks")
    void failingTask() throws InterruptedException {
        var latch = new CountDownLatch(1);

        dispatcher.post(() -> {
            throw new IllegalStateException("boom");
        });
        dispatcher.post(latch::countDown);

        assertTrue(latch.await(5, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("Cancelled delayed task never runs")
    void cancel() throws InterruptedException {
        var ran = new AtomicBoolean(false);
        var handle = dispatcher.postDelayed(() -> ran.set(true), Duration.ofMillis(200));

        handle.cancel();
        var latch = new CountDownLatch(1);
        dispatcher.postDelayed(latch::countDown, Duration.ofMillis(400));

        assertTrue(latch.await(5, TimeUnit.SECONDS));
        assertFalse(ran.get());
    }
}
