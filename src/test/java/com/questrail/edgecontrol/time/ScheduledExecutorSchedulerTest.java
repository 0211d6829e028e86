package com.questrail.edgecontrol.time;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledExecutorSchedulerTest
 * -----------------------------------------------------------------------------
 * Tests for the executor-backed scheduler that drives the evaluation cadence.
 *
 * Note: These tests use real time. Tolerances are set generously to avoid
 * false failures on loaded machines.
 */
class ScheduledExecutorSchedulerTest {

    private ScheduledExecutorService executor;
    private ScheduledExecutorScheduler scheduler;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadScheduledExecutor();
        scheduler = new ScheduledExecutorScheduler(executor, SystemMonotonicClock.INSTANCE);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void taskExecutesAfterDeadline() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(50);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(1, TimeUnit.SECONDS), "Task should execute");
    }

    @Test
    void pastDeadlineExecutesImmediately() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() - TimeUnit.SECONDS.toNanos(1);
        scheduler.scheduleAtNanos(deadline, latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS), "Task should execute immediately");
    }

    @Test
    void cancelPreventsExecution() throws InterruptedException {
        AtomicBoolean executed = new AtomicBoolean(false);

        long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + TimeUnit.MILLISECONDS.toNanos(100);
        Cancellable handle = scheduler.scheduleAtNanos(deadline, () -> executed.set(true));

        assertTrue(handle.cancel(), "Cancel should succeed");
        Thread.sleep(200);

        assertFalse(executed.get(), "Cancelled task should not execute");
    }

    @Test
    void cancelAfterExecutionReturnsFalse() throws InterruptedException {
        CountDownLatch latch = new CountDownLatch(1);

        Cancellable handle = scheduler.scheduleAtNanos(SystemMonotonicClock.INSTANCE.nowNanos(), latch::countDown);

        assertTrue(latch.await(500, TimeUnit.MILLISECONDS));
        Thread.sleep(20);
        assertFalse(handle.cancel(), "Cancel after execution should return false");
    }

    @Test
    void multipleTasksExecuteInDeadlineOrder() throws InterruptedException {
        AtomicInteger counter = new AtomicInteger(0);
        CountDownLatch latch = new CountDownLatch(3);
        int[] executionOrder = new int[3];

        long now = SystemMonotonicClock.INSTANCE.nowNanos();
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(60), () -> {
            executionOrder[2] = counter.incrementAndGet();
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(40), () -> {
            executionOrder[1] = counter.incrementAndGet();
            latch.countDown();
        });
        scheduler.scheduleAtNanos(now + TimeUnit.MILLISECONDS.toNanos(20), () -> {
            executionOrder[0] = counter.incrementAndGet();
            latch.countDown();
        });

        assertTrue(latch.await(1, TimeUnit.SECONDS));
        assertEquals(1, executionOrder[0]);
        assertEquals(2, executionOrder[1]);
        assertEquals(3, executionOrder[2]);
    }
}
