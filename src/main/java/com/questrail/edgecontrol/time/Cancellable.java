package com.questrail.edgecontrol.time;

/**
 * Cancellation handle for a deadline, pause or periodic tick armed on a
 * {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Attempt to cancel the scheduled task.
     *
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran or was cancelled before.
     */
    boolean cancel();
}
