package com.questrail.edgecontrol.config;

import com.questrail.edgecontrol.rule.SensorType;
import com.questrail.edgecontrol.rule.SensorType.ValueRange;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thresholds of the data-quality gate that runs before every condition.
 *
 * <ul>
 *   <li><b>maxSampleAge</b> - readings older than this are stale (default 5 minutes)</li>
 *   <li><b>ranges</b> - per sensor type hardware range; types without an entry use
 *       {@link SensorType#defaultRange()}</li>
 * </ul>
 */
public record DataQualityPolicy(Duration maxSampleAge, Map<SensorType, ValueRange> ranges) {

    public DataQualityPolicy {
        Objects.requireNonNull(maxSampleAge, "maxSampleAge");
        Objects.requireNonNull(ranges, "ranges");
        if (maxSampleAge.isNegative()) {
            throw new IllegalArgumentException("maxSampleAge must be non-negative");
        }
        ranges = Map.copyOf(ranges);
    }

    public static DataQualityPolicy defaults() {
        return new DataQualityPolicy(Duration.ofMinutes(5), Map.of());
    }

    public ValueRange rangeFor(SensorType type) {
        ValueRange override = ranges.get(type);
        return override != null ? override : type.defaultRange();
    }

    public DataQualityPolicy withRange(SensorType type, ValueRange range) {
        Map<SensorType, ValueRange> copy = new EnumMap<>(SensorType.class);
        copy.putAll(ranges);
        copy.put(type, range);
        return new DataQualityPolicy(maxSampleAge, copy);
    }
}
