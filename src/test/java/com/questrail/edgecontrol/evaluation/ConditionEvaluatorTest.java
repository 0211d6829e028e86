package com.questrail.edgecontrol.evaluation;

import com.questrail.edgecontrol.api.SensorRef;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.config.DataQualityPolicy;
import com.questrail.edgecontrol.rule.ComparisonOperator;
import com.questrail.edgecontrol.rule.Condition;
import com.questrail.edgecontrol.rule.FallbackStrategy;
import com.questrail.edgecontrol.rule.SensorType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConditionEvaluatorTest
 * -----------------------------------------------------------------------------
 * Data-quality gate order, fallback strategies and operator semantics.
 */
class ConditionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-03-04T10:00:00Z");
    private static final SensorRef TEMP = SensorRef.of("esp1", 4);

    private final ConditionEvaluator evaluator = new ConditionEvaluator(DataQualityPolicy.defaults());

    private static Condition above(double threshold) {
        return Condition.of(TEMP, ComparisonOperator.GREATER_THAN, threshold, SensorType.TEMPERATURE);
    }

    private static Optional<SensorSample> reading(Object value, Duration age) {
        return Optional.of(new SensorSample(TEMP, value, NOW.minus(age)));
    }

    @Test
    void freshReadingIsCompared() {
        ConditionOutcome hot = evaluator.evaluate(above(25), reading(30.0, Duration.ofSeconds(5)), NOW);
        ConditionOutcome cold = evaluator.evaluate(above(25), reading(20.0, Duration.ofSeconds(5)), NOW);

        assertTrue(hot.result());
        assertEquals(DataQuality.OK, hot.quality());
        assertFalse(cold.result());
        assertFalse(cold.fellBack());
    }

    @Test
    void missingSampleUsesFallback() {
        ConditionOutcome outcome = evaluator.evaluate(above(25).withFallback(FallbackStrategy.SAFE_ON),
                Optional.empty(), NOW);

        assertTrue(outcome.result());
        assertEquals(DataQuality.MISSING, outcome.quality());
    }

    @Test
    void nonNumericValueUsesFallback() {
        ConditionOutcome outcome = evaluator.evaluate(above(25), reading("warm", Duration.ZERO), NOW);

        assertFalse(outcome.result());
        assertEquals(DataQuality.NON_NUMERIC, outcome.quality());
    }

    @Test
    void numericStringIsAccepted() {
        ConditionOutcome outcome = evaluator.evaluate(above(25), reading("31.5", Duration.ZERO), NOW);

        assertTrue(outcome.result());
        assertEquals(DataQuality.OK, outcome.quality());
    }

    @Test
    void staleSampleAlwaysYieldsFallbackRegardlessOfOperator() {
        Optional<SensorSample> stale = reading(30.0, Duration.ofMinutes(5).plusSeconds(1));

        for (ComparisonOperator op : ComparisonOperator.values()) {
            for (double threshold : new double[]{-100, 0, 30, 100}) {
                Condition safeOff = Condition.of(TEMP, op, threshold, SensorType.TEMPERATURE);
                Condition safeOn = safeOff.withFallback(FallbackStrategy.SAFE_ON);

                ConditionOutcome off = evaluator.evaluate(safeOff, stale, NOW);
                ConditionOutcome on = evaluator.evaluate(safeOn, stale, NOW);

                assertEquals(DataQuality.STALE, off.quality());
                assertFalse(off.result(), op + " " + threshold);
                assertTrue(on.result(), op + " " + threshold);
            }
        }
    }

    @Test
    void sampleExactlyAtAgeLimitIsStillFresh() {
        ConditionOutcome outcome = evaluator.evaluate(above(25), reading(30.0, Duration.ofMinutes(5)), NOW);

        assertEquals(DataQuality.OK, outcome.quality());
    }

    @Test
    void outOfHardwareRangeUsesFallback() {
        ConditionOutcome outcome = evaluator.evaluate(above(25).withDefault(true),
                reading(130.0, Duration.ZERO), NOW);

        assertEquals(DataQuality.OUT_OF_RANGE, outcome.quality());
        assertTrue(outcome.result());
    }

    @Test
    void humidityRangeIsZeroToHundred() {
        SensorRef humidity = SensorRef.of("esp1", 7);
        Condition c = Condition.of(humidity, ComparisonOperator.LESS_THAN, 40, SensorType.HUMIDITY);

        ConditionOutcome negative = evaluator.evaluate(c,
                Optional.of(SensorSample.of(humidity, -1, NOW)), NOW);
        ConditionOutcome valid = evaluator.evaluate(c,
                Optional.of(SensorSample.of(humidity, 35, NOW)), NOW);

        assertEquals(DataQuality.OUT_OF_RANGE, negative.quality());
        assertTrue(valid.result());
    }

    @Test
    void gateChecksStalenessBeforeRange() {
        ConditionOutcome outcome = evaluator.evaluate(above(25), reading(500.0, Duration.ofHours(1)), NOW);

        assertEquals(DataQuality.STALE, outcome.quality());
    }

    @Test
    void maintainLastUsesLastValidResult() {
        Condition c = above(25).withFallback(FallbackStrategy.MAINTAIN_LAST);

        assertTrue(evaluator.evaluate(c, Optional.empty(), Optional.of(true), NOW).result());
        assertFalse(evaluator.evaluate(c, Optional.empty(), Optional.of(false), NOW).result());
        assertFalse(evaluator.evaluate(c, Optional.empty(), Optional.empty(), NOW).result());
    }

    @Test
    void useDefaultReturnsConfiguredDefault() {
        assertTrue(evaluator.evaluate(above(25).withDefault(true), Optional.empty(), NOW).result());
        assertFalse(evaluator.evaluate(above(25).withDefault(false), Optional.empty(), NOW).result());
    }

    @Test
    void unrecognizedOperatorIsAlwaysFalse() {
        Condition c = Condition.of(TEMP, ComparisonOperator.parse("~="), 0, SensorType.TEMPERATURE);

        assertEquals(ComparisonOperator.UNRECOGNIZED, c.operator());
        assertFalse(evaluator.evaluate(c, reading(20.0, Duration.ZERO), NOW).result());
    }

    @Test
    void overriddenRangeIsHonoured() {
        DataQualityPolicy policy = DataQualityPolicy.defaults()
                .withRange(SensorType.TEMPERATURE, new SensorType.ValueRange(0, 50));
        ConditionEvaluator strict = new ConditionEvaluator(policy);

        assertEquals(DataQuality.OUT_OF_RANGE,
                strict.evaluate(above(25), reading(60.0, Duration.ZERO), NOW).quality());
    }
}
