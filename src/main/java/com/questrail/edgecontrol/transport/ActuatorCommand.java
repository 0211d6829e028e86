package com.questrail.edgecontrol.transport;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.ProposalSource;

import java.time.Instant;
import java.util.Objects;

/**
 * Authoritative command handed to the transport. The payload shape on the wire
 * belongs to the transport.
 */
public record ActuatorCommand(
        ActuatorRef actuator,
        ActuatorState state,
        ProposalSource source,
        String reason,
        Instant issuedAt
)
{
    public ActuatorCommand {
        Objects.requireNonNull(actuator, "actuator");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(issuedAt, "issuedAt");
        reason = reason == null ? "" : reason;
    }
}
