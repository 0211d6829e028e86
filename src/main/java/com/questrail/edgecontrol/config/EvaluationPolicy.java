package com.questrail.edgecontrol.config;

import java.time.Duration;
import java.util.Objects;

/**
 * EvaluationPolicy
 * -----------------------------------------------------------------------------
 * Operational timing and batching of the evaluation scheduler.
 *
 * <p>These values bound load and latency; they do not change what a rule
 * means.</p>
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>tickInterval</b> - cadence of evaluation passes</li>
 *   <li><b>batchSize</b> - processes per batch</li>
 *   <li><b>maxInFlight</b> - evaluations running at once inside a batch</li>
 *   <li><b>batchPause</b> - pause between consecutive batches of one pass</li>
 *   <li><b>evaluationTimeout</b> - bound on a single process evaluation</li>
 *   <li><b>remoteFetchTimeout</b> - bound on a single remote sensor fetch</li>
 *   <li><b>slowEvaluationThreshold</b> - evaluations slower than this mark their rule as slow</li>
 * </ul>
 */
public record EvaluationPolicy(
        Duration tickInterval,
        int batchSize,
        int maxInFlight,
        Duration batchPause,
        Duration evaluationTimeout,
        Duration remoteFetchTimeout,
        Duration slowEvaluationThreshold
) {
    public EvaluationPolicy {
        requirePositive(tickInterval, "tickInterval");
        requireNonNegative(batchPause, "batchPause");
        requirePositive(evaluationTimeout, "evaluationTimeout");
        requirePositive(remoteFetchTimeout, "remoteFetchTimeout");
        requireNonNegative(slowEvaluationThreshold, "slowEvaluationThreshold");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxInFlight <= 0) {
            throw new IllegalArgumentException("maxInFlight must be > 0");
        }
    }

    /**
     * Defaults: 5 s cadence, batches of 10 fully parallel, 100 ms between
     * batches, 2 s per evaluation, 5 s per remote fetch, 1 s slow threshold.
     */
    public static EvaluationPolicy defaults() {
        return new EvaluationPolicy(
                Duration.ofSeconds(5),
                10,
                10,
                Duration.ofMillis(100),
                Duration.ofSeconds(2),
                Duration.ofSeconds(5),
                Duration.ofSeconds(1)
        );
    }

    public EvaluationPolicy withBatching(int batchSize, int maxInFlight, Duration batchPause) {
        return new EvaluationPolicy(tickInterval, batchSize, maxInFlight, batchPause,
                evaluationTimeout, remoteFetchTimeout, slowEvaluationThreshold);
    }

    public EvaluationPolicy withTimeouts(Duration evaluationTimeout, Duration remoteFetchTimeout) {
        return new EvaluationPolicy(tickInterval, batchSize, maxInFlight, batchPause,
                evaluationTimeout, remoteFetchTimeout, slowEvaluationThreshold);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative()) {
            throw new IllegalArgumentException(name + " must be non-negative");
        }
    }
}
