package com.questrail.edgecontrol.rule;

import java.time.Duration;
import java.util.Objects;

/**
 * A named signal a rule waits for. Satisfied while the signal was raised no
 * longer than {@code maxAge} ago.
 */
public record LogicEvent(String name, Duration maxAge) {
    public LogicEvent {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(maxAge, "maxAge");
        if (maxAge.isNegative()) {
            throw new IllegalArgumentException("maxAge must be non-negative");
        }
    }
}
