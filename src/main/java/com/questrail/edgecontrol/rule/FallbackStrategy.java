package com.questrail.edgecontrol.rule;

/**
 * What a condition evaluates to when its sensor reading cannot be trusted
 * (missing, not numeric, stale or outside the sensor's hardware range).
 */
public enum FallbackStrategy {
    /** The condition is false. */
    SAFE_OFF,
    /** The condition is true. */
    SAFE_ON,
    /** The condition keeps its last result computed from a valid reading; false if there is none. */
    MAINTAIN_LAST,
    /** The condition takes its configured default value. */
    USE_DEFAULT
}
