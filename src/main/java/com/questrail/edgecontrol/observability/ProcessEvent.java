package com.questrail.edgecontrol.observability;

import com.questrail.edgecontrol.api.ActuatorRef;

import java.time.Instant;

/**
 * Lifecycle or diagnostic event of a single logic process.
 */
public record ProcessEvent(
    Instant timestamp,
    ProcessEventType type,
    ActuatorRef actuator,
    String ruleId,
    String detail
) {
}
