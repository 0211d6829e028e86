package com.questrail.edgecontrol.evaluation;

import java.util.Objects;

/**
 * Result of one condition. When {@code quality} is not {@link DataQuality#OK}
 * the result came from the condition's fallback strategy.
 */
public record ConditionOutcome(boolean result, DataQuality quality) {

    public ConditionOutcome {
        Objects.requireNonNull(quality, "quality");
    }

    public boolean fellBack() {
        return !quality.usable();
    }
}
