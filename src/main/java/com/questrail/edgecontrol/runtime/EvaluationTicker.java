package com.questrail.edgecontrol.runtime;

import com.questrail.edgecontrol.observability.EngineErrorEvent;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.time.Cancellable;
import com.questrail.edgecontrol.time.MonotonicClock;
import com.questrail.edgecontrol.time.MonotonicScheduler;
import com.questrail.edgecontrol.time.WallClock;

import java.time.Duration;
import java.util.Objects;

/**
 * Fixed-rate cadence on a {@link MonotonicScheduler}.
 *
 * <p>Deadlines advance by the interval from the previous deadline, not from
 * the end of the previous tick, so a slow tick does not shift the cadence.
 * Overlap is the tick's own concern.</p>
 */
public final class EvaluationTicker {

    private final Object lock = new Object();

    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Duration interval;
    private final Runnable tick;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;

    private boolean running;
    private long nextDeadlineNanos;
    private Cancellable armed;

    public EvaluationTicker(MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            Duration interval,
                            Runnable tick,
                            WallClock wallClock,
                            EngineObservabilitySink sink) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.tick = Objects.requireNonNull(tick, "tick");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public void start() {
        synchronized (lock) {
            if (running) {
                return;
            }
            running = true;
            nextDeadlineNanos = clock.nowNanos() + interval.toNanos();
            armed = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
        }
    }

    public void stop() {
        synchronized (lock) {
            running = false;
            if (armed != null) {
                armed.cancel();
                armed = null;
            }
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    private void fire() {
        synchronized (lock) {
            if (!running) {
                return;
            }
        }

        try {
            tick.run();
        } catch (RuntimeException e) {
            sink.onError(new EngineErrorEvent(wallClock.now(), "Evaluation tick failed", e));
        }

        synchronized (lock) {
            if (running) {
                nextDeadlineNanos += interval.toNanos();
                armed = scheduler.scheduleAtNanos(nextDeadlineNanos, this::fire);
            }
        }
    }
}
