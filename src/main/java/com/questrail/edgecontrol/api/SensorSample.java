package com.questrail.edgecontrol.api;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * SensorSample
 * -----------------------------------------------------------------------------
 * A single reading as delivered by the transport collaborator.
 *
 * <p>The payload is kept as received. Field controllers report numbers, but a
 * misconfigured or failing device may report a string, an empty value or
 * {@code NaN}; the condition evaluator's data-quality gate decides what to do
 * with those. {@link #numericValue()} is the only interpretation the engine
 * applies.</p>
 */
public record SensorSample(SensorRef sensor, Object value, Instant timestamp)
{
    public SensorSample {
        Objects.requireNonNull(sensor, "sensor");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static SensorSample of(SensorRef sensor, double value, Instant timestamp) {
        return new SensorSample(sensor, value, timestamp);
    }

    /**
     * The payload as a finite number, or empty if it is missing, not a number,
     * or not finite.
     */
    public OptionalDouble numericValue() {
        double parsed;
        if (value instanceof Number number) {
            parsed = number.doubleValue();
        } else if (value instanceof String text && !text.isBlank()) {
            try {
                parsed = Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
    }
}
