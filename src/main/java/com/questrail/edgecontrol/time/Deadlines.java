package com.questrail.edgecontrol.time;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Deadlines
 * -----------------------------------------------------------------------------
 * Races an asynchronous operation against a monotonic deadline.
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>The returned future always completes normally, with a
 *       {@link FetchResult}.</li>
 *   <li>If the deadline fires first the operation's future is cancelled and the
 *       result is {@link FetchResult.TimedOut}. A late completion is ignored.</li>
 *   <li>If the operation completes first the armed deadline is cancelled.</li>
 *   <li>An operation that throws while being started yields
 *       {@link FetchResult.Failed}; it does not propagate to the caller.</li>
 * </ul>
 */
public final class Deadlines {

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;

    public Deadlines(MonotonicScheduler scheduler, MonotonicClock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public <T> CompletableFuture<FetchResult<T>> fetchWithDeadline(Supplier<CompletableFuture<T>> operation,
                                                                  Duration timeout) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(timeout, "timeout");

        CompletableFuture<FetchResult<T>> result = new CompletableFuture<>();

        final CompletableFuture<T> pending;
        try {
            pending = Objects.requireNonNull(operation.get(), "operation returned null future");
        } catch (RuntimeException e) {
            result.complete(FetchResult.failed(e));
            return result;
        }

        Cancellable deadline = scheduler.scheduleAfter(timeout, clock, () -> {
            if (result.complete(FetchResult.timedOut(timeout))) {
                pending.cancel(true);
            }
        });

        pending.whenComplete((value, error) -> {
            deadline.cancel();
            if (error == null) {
                result.complete(FetchResult.completed(value));
            } else {
                result.complete(FetchResult.failed(unwrap(error)));
            }
        });

        return result;
    }

    /**
     * Completes after {@code delay} on the scheduler. A zero delay completes
     * immediately without touching the scheduler.
     */
    public CompletableFuture<Void> pause(Duration delay) {
        if (delay.isZero()) {
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Void> done = new CompletableFuture<>();
        scheduler.scheduleAfter(delay, clock, () -> done.complete(null));
        return done;
    }

    public MonotonicClock clock() {
        return clock;
    }

    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
