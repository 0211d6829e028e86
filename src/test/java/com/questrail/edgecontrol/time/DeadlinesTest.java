package com.questrail.edgecontrol.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeadlinesTest
 * -----------------------------------------------------------------------------
 * fetchWithDeadline and pause under a deterministic clock.
 */
class DeadlinesTest {

    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private Deadlines deadlines;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        deadlines = new Deadlines(scheduler, clock);
    }

    @Test
    void completionBeforeDeadlineIsCompleted() {
        CompletableFuture<String> op = new CompletableFuture<>();
        CompletableFuture<FetchResult<String>> result = deadlines.fetchWithDeadline(() -> op, Duration.ofSeconds(5));

        op.complete("21.5");

        assertEquals(FetchResult.completed("21.5"), result.join());
        assertEquals(0, scheduler.pendingCount(), "deadline must be disarmed");
    }

    @Test
    void operationThatNeverResolvesTimesOutAndIsCancelled() {
        CompletableFuture<String> op = new CompletableFuture<>();
        CompletableFuture<FetchResult<String>> result = deadlines.fetchWithDeadline(() -> op, Duration.ofSeconds(5));

        clock.advanceMillis(4_999);
        scheduler.runDueTasks();
        assertFalse(result.isDone());

        clock.advanceMillis(1);
        scheduler.runDueTasks();

        assertTrue(result.join().isTimedOut());
        assertEquals(Duration.ofSeconds(5), ((FetchResult.TimedOut<String>) result.join()).bound());
        assertTrue(op.isCancelled());
    }

    @Test
    void lateCompletionIsIgnored() {
        CompletableFuture<String> op = new CompletableFuture<>();
        CompletableFuture<FetchResult<String>> result = deadlines.fetchWithDeadline(() -> op, Duration.ofMillis(10));

        clock.advanceMillis(10);
        scheduler.runDueTasks();
        op.complete("late");

        assertTrue(result.join().isTimedOut());
    }

    @Test
    void failureIsUnwrapped() {
        IllegalStateException boom = new IllegalStateException("boom");
        CompletableFuture<FetchResult<String>> result = deadlines.fetchWithDeadline(
                () -> CompletableFuture.<String>completedFuture(null)
                        .<String>thenApply(v -> { throw new CompletionException(boom); }),
                Duration.ofSeconds(1));

        FetchResult<String> r = result.join();
        assertInstanceOf(FetchResult.Failed.class, r);
        assertSame(boom, ((FetchResult.Failed<String>) r).cause());
    }

    @Test
    void throwingStarterYieldsFailedResult() {
        CompletableFuture<FetchResult<String>> result = deadlines.fetchWithDeadline(
                () -> { throw new IllegalArgumentException("no route"); },
                Duration.ofSeconds(1));

        assertInstanceOf(FetchResult.Failed.class, result.join());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    void pauseCompletesOnlyAfterDelay() {
        CompletableFuture<Void> pause = deadlines.pause(Duration.ofMillis(100));

        scheduler.runDueTasks();
        assertFalse(pause.isDone());

        clock.advanceMillis(100);
        scheduler.runDueTasks();
        assertTrue(pause.isDone());
    }

    @Test
    void zeroPauseIsImmediate() {
        assertTrue(deadlines.pause(Duration.ZERO).isDone());
        assertEquals(0, scheduler.pendingCount());
    }
}
