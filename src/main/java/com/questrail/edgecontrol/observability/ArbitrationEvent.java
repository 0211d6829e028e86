package com.questrail.edgecontrol.observability;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.StateProposal;

import java.time.Instant;

/**
 * Outcome of one arbitration of an actuator.
 */
public record ArbitrationEvent(
    Instant timestamp,
    ActuatorRef actuator,
    StateProposal winner,
    int activeProposals,
    boolean changed
) {
}
