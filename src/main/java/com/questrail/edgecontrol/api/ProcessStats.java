package com.questrail.edgecontrol.api;

import java.util.Set;

/**
 * Snapshot of scheduler and process-store statistics.
 *
 * @param running                  logic processes currently running
 * @param totalEvaluations         process evaluations completed since start
 * @param averageEvaluationTimeMs  running mean of per-process evaluation time
 * @param slowRuleIds              rules whose last evaluation exceeded the slow threshold
 * @param batchCount               batches executed
 * @param lastBatchTimeMs          duration of the most recent batch
 * @param preventedRaces           ticks skipped because a previous tick was still executing
 * @param failsafeActivations      failsafe activations triggered by the scheduler
 */
public record ProcessStats(
        int running,
        long totalEvaluations,
        double averageEvaluationTimeMs,
        Set<String> slowRuleIds,
        long batchCount,
        double lastBatchTimeMs,
        long preventedRaces,
        long failsafeActivations
)
{
    public ProcessStats {
        slowRuleIds = Set.copyOf(slowRuleIds);
    }
}
