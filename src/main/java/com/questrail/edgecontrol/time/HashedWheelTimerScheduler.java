package com.questrail.edgecontrol.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * HashedWheelTimerScheduler
 * =============================================================================
 * {@link MonotonicScheduler} backed by Netty's {@link HashedWheelTimer}.
 *
 * <p>A tick evaluates up to a hundred processes and each one may race several
 * remote fetches against a deadline. Most of those deadlines are cancelled long
 * before they expire, which is the workload a timer wheel is built for: O(1)
 * arm and cancel, at the cost of tick-granular precision.</p>
 *
 * <p>Expired tasks are handed to {@code dispatchExecutor} so that a slow
 * timeout handler (a failsafe publish, for example) cannot stall the wheel's
 * worker thread.</p>
 *
 * <p>The timer is owned by this class and released by {@link #stop()}.</p>
 */
public final class HashedWheelTimerScheduler implements MonotonicScheduler {

    private final Timer timer;
    private final MonotonicClock clock;
    private final Executor dispatchExecutor;

    public HashedWheelTimerScheduler(MonotonicClock clock, Executor dispatchExecutor, long tickMillis) {
        this(new HashedWheelTimer(
                runnable -> {
                    Thread t = new Thread(runnable, "edgecontrol-deadline-wheel");
                    t.setDaemon(true);
                    return t;
                },
                tickMillis,
                TimeUnit.MILLISECONDS), clock, dispatchExecutor);
    }

    HashedWheelTimerScheduler(Timer timer, MonotonicClock clock, Executor dispatchExecutor) {
        this.timer = Objects.requireNonNull(timer, "timer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.dispatchExecutor = Objects.requireNonNull(dispatchExecutor, "dispatchExecutor");
    }

    @Override
    public Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Objects.requireNonNull(task, "task");

        long delayNanos = Math.max(0, deadlineNanos - clock.nowNanos());
        Timeout timeout = timer.newTimeout(
                expired -> dispatchExecutor.execute(task),
                delayNanos,
                TimeUnit.NANOSECONDS);

        return timeout::cancel;
    }

    /**
     * Stops the wheel. Pending deadlines are dropped without running.
     */
    public void stop() {
        timer.stop();
    }
}
