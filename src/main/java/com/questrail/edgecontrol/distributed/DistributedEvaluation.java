package com.questrail.edgecontrol.distributed;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one distributed evaluation.
 *
 * @param fired           every trigger and condition held
 * @param signals         per trigger and condition outcome, triggers first
 * @param actions         per action delivery outcome; empty unless fired
 * @param failsafeApplied failsafe was applied to every action target
 * @param error           what made the evaluation untrustworthy, if anything
 */
public record DistributedEvaluation(
        String ruleId,
        boolean fired,
        List<SignalResult> signals,
        List<ActionResult> actions,
        boolean failsafeApplied,
        Optional<String> error
) {
    public DistributedEvaluation {
        Objects.requireNonNull(ruleId, "ruleId");
        signals = List.copyOf(signals);
        actions = List.copyOf(actions);
        Objects.requireNonNull(error, "error");
    }
}
