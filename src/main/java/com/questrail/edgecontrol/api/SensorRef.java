package com.questrail.edgecontrol.api;

import java.util.Objects;
import java.util.Optional;

/**
 * SensorRef
 * -----------------------------------------------------------------------------
 * Identity of one sensor input.
 *
 * <p>A sensor may live on the same field controller as the actuator a rule
 * drives, on a different controller behind the same edge aggregator, or behind
 * a different aggregator altogether. The last case is expressed by naming the
 * aggregator explicitly; {@link #aggregator()} is empty when the sensor is
 * reachable without an extra hop.</p>
 */
public record SensorRef(String controllerId, int pin, String aggregatorId)
{
    public SensorRef {
        Objects.requireNonNull(controllerId, "controllerId");
        if (pin < 0) {
            throw new IllegalArgumentException("pin must be >= 0");
        }
    }

    public static SensorRef of(String controllerId, int pin) {
        return new SensorRef(controllerId, pin, null);
    }

    public static SensorRef via(String aggregatorId, String controllerId, int pin) {
        return new SensorRef(controllerId, pin, Objects.requireNonNull(aggregatorId, "aggregatorId"));
    }

    public Optional<String> aggregator() {
        return Optional.ofNullable(aggregatorId);
    }

    /**
     * Whether this sensor lives on the given field controller.
     */
    public boolean isOn(String otherControllerId) {
        return aggregatorId == null && controllerId.equals(otherControllerId);
    }

    @Override
    public String toString() {
        return aggregatorId == null
                ? controllerId + ":" + pin
                : aggregatorId + "/" + controllerId + ":" + pin;
    }
}
