package com.questrail.edgecontrol.rule;

import java.util.Locale;

/**
 * Sensor families with a known hardware range. Readings outside the range are
 * treated as faulty.
 */
public enum SensorType {
    TEMPERATURE(-40, 125),
    HUMIDITY(0, 100),
    PRESSURE(300, 1100),
    LIGHT(0, 65535),
    SOIL_MOISTURE(0, 1023),
    GENERIC(-1000, 10000);

    private final ValueRange range;

    SensorType(double min, double max) {
        this.range = new ValueRange(min, max);
    }

    public ValueRange defaultRange() {
        return range;
    }

    /**
     * Unknown or missing type names map to {@link #GENERIC}.
     */
    public static SensorType parse(String name) {
        if (name == null) {
            return GENERIC;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return GENERIC;
        }
    }

    /**
     * Inclusive value range.
     */
    public record ValueRange(double min, double max) {
        public ValueRange {
            if (min > max) {
                throw new IllegalArgumentException("min > max: " + min + " > " + max);
            }
        }

        public boolean contains(double value) {
            return value >= min && value <= max;
        }
    }
}
