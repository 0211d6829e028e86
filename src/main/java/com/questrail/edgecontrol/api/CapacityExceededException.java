package com.questrail.edgecontrol.api;

/**
 * Thrown synchronously by {@code startProcess} when the ceiling of concurrently
 * running logic processes has been reached.
 */
public final class CapacityExceededException extends EdgeControlException
{
    private final int limit;

    public CapacityExceededException(int limit) {
        super("Maximum number of running logic processes reached (" + limit + ")");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
