package com.questrail.edgecontrol.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every operational bound in the engine: evaluation cadence,
 * per-process evaluation timeouts, remote fetch deadlines and inter-batch pauses.
 *
 * <p>
 * Sample age, backup age and time-of-day windows are wall-clock questions and
 * use {@link WallClock} instead. Nothing that decides whether an evaluation ran
 * too long may use wall-clock time.
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
