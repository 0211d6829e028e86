package com.questrail.edgecontrol.observability;

import java.time.Instant;

/**
 * Record describing one evaluation pass of the scheduler.
 */
public record SchedulerEvent(
    Instant timestamp,
    Type type,
    String detail
) {
    public enum Type {
        PASS_COMPLETED,
        PASS_SKIPPED,
        SLOW_EVALUATION
    }
}
