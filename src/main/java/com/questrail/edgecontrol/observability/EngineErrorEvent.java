package com.questrail.edgecontrol.observability;

import java.time.Instant;

/**
 * Record representing an error or anomaly in the engine.
 */
public record EngineErrorEvent(
    Instant timestamp,
    String message,
    Throwable cause
) {
}
