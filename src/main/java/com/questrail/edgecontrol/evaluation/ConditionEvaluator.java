package com.questrail.edgecontrol.evaluation;

import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.config.DataQualityPolicy;
import com.questrail.edgecontrol.rule.Condition;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * ConditionEvaluator
 * =============================================================================
 *
 * Decides whether a single condition holds against a sensor reading.
 *
 * <h2>Data-quality gate</h2>
 * Runs before the comparison, in this order:
 * <ol>
 *   <li>no sample: {@link DataQuality#MISSING}</li>
 *   <li>value not a finite number: {@link DataQuality#NON_NUMERIC}</li>
 *   <li>older than {@link DataQualityPolicy#maxSampleAge()}: {@link DataQuality#STALE}</li>
 *   <li>outside the sensor type's hardware range: {@link DataQuality#OUT_OF_RANGE}</li>
 * </ol>
 * A failed gate never throws. The condition's {@link com.questrail.edgecontrol.rule.FallbackStrategy}
 * supplies the result instead.
 *
 * <h2>Fallbacks</h2>
 * <ul>
 *   <li>SAFE_OFF - false</li>
 *   <li>SAFE_ON - true</li>
 *   <li>MAINTAIN_LAST - the last result computed from usable data, false if none</li>
 *   <li>USE_DEFAULT - the condition's configured default</li>
 * </ul>
 *
 * <p>Stateless apart from the policy; "last valid" is owned by the caller.</p>
 */
public final class ConditionEvaluator {

    private final DataQualityPolicy policy;

    public ConditionEvaluator(DataQualityPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public ConditionOutcome evaluate(Condition condition, Optional<SensorSample> sample, Instant now) {
        return evaluate(condition, sample, Optional.empty(), now);
    }

    public ConditionOutcome evaluate(Condition condition,
                                     Optional<SensorSample> sample,
                                     Optional<Boolean> lastValid,
                                     Instant now) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(sample, "sample");
        Objects.requireNonNull(lastValid, "lastValid");
        Objects.requireNonNull(now, "now");

        DataQuality quality = inspect(condition, sample, now);
        if (!quality.usable()) {
            return new ConditionOutcome(fallback(condition, lastValid), quality);
        }

        double value = sample.get().numericValue().getAsDouble();
        return new ConditionOutcome(condition.operator().test(value, condition.threshold()), DataQuality.OK);
    }

    public DataQuality inspect(Condition condition, Optional<SensorSample> sample, Instant now) {
        if (sample.isEmpty()) {
            return DataQuality.MISSING;
        }
        OptionalDouble value = sample.get().numericValue();
        if (value.isEmpty()) {
            return DataQuality.NON_NUMERIC;
        }
        Duration age = Duration.between(sample.get().timestamp(), now);
        if (age.compareTo(policy.maxSampleAge()) > 0) {
            return DataQuality.STALE;
        }
        if (!policy.rangeFor(condition.sensorType()).contains(value.getAsDouble())) {
            return DataQuality.OUT_OF_RANGE;
        }
        return DataQuality.OK;
    }

    private static boolean fallback(Condition condition, Optional<Boolean> lastValid) {
        switch (condition.fallback()) {
            case SAFE_ON:
                return true;
            case MAINTAIN_LAST:
                return lastValid.orElse(false);
            case USE_DEFAULT:
                return condition.defaultValue();
            case SAFE_OFF:
            default:
                return false;
        }
    }
}
