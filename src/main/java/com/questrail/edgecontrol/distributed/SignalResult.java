package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.SensorRef;

import java.util.Objects;

/**
 * Outcome of one trigger or condition of a cross-controller rule.
 */
public record SignalResult(Role role, int index, SensorRef sensor, boolean active, Reason reason) {

    public enum Role {
        TRIGGER,
        CONDITION
    }

    public enum Reason {
        CONDITION_MET,
        CONDITION_NOT_MET,
        /** The controller answered but had no reading; the fallback decided. */
        SENSOR_UNAVAILABLE,
        /** A reading arrived but failed the data-quality gate; the fallback decided. */
        DATA_QUALITY_FALLBACK,
        TIMEOUT,
        EVALUATION_ERROR
    }

    public SignalResult {
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(sensor, "sensor");
        Objects.requireNonNull(reason, "reason");
    }
}
