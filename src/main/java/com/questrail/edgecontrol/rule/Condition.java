package com.questrail.edgecontrol.rule;

import com.questrail.edgecontrol.api.SensorRef;

import java.util.Objects;

/**
 * Condition
 * -----------------------------------------------------------------------------
 * {@code sensor <operator> threshold}, plus what to assume when the sensor
 * cannot be trusted.
 *
 * <p>The sensor may live on another field controller or behind another edge
 * aggregator; the scheduler routes such reads through the distributed
 * coordinator.</p>
 */
public record Condition(
        SensorRef sensor,
        ComparisonOperator operator,
        double threshold,
        SensorType sensorType,
        FallbackStrategy fallback,
        boolean defaultValue
) {
    public Condition {
        Objects.requireNonNull(sensor, "sensor");
        Objects.requireNonNull(operator, "operator");
        sensorType = sensorType == null ? SensorType.GENERIC : sensorType;
        fallback = fallback == null ? FallbackStrategy.SAFE_OFF : fallback;
    }

    /**
     * A condition with the default {@link FallbackStrategy#SAFE_OFF} strategy.
     */
    public static Condition of(SensorRef sensor, ComparisonOperator operator, double threshold, SensorType type) {
        return new Condition(sensor, operator, threshold, type, FallbackStrategy.SAFE_OFF, false);
    }

    public Condition withFallback(FallbackStrategy strategy) {
        return new Condition(sensor, operator, threshold, sensorType, strategy, defaultValue);
    }

    public Condition withDefault(boolean value) {
        return new Condition(sensor, operator, threshold, sensorType, FallbackStrategy.USE_DEFAULT, value);
    }
}
