package com.questrail.edgecontrol.evaluation;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated verdict for one rule: it fires when every condition holds, at
 * least one timer window is active and every event is satisfied. Empty
 * categories are satisfied.
 */
public record RuleVerdict(
        boolean fire,
        boolean conditionsMet,
        boolean timersActive,
        boolean eventsActive,
        List<ConditionOutcome> outcomes,
        String reason
) {
    public RuleVerdict {
        outcomes = List.copyOf(outcomes);
        Objects.requireNonNull(reason, "reason");
    }

    public boolean anyFallback() {
        return outcomes.stream().anyMatch(ConditionOutcome::fellBack);
    }
}
