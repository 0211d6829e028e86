package com.questrail.edgecontrol.api;

import java.time.Instant;
import java.util.Objects;

/**
 * StateProposal
 * -----------------------------------------------------------------------------
 * One producer's wish for the state of one actuator.
 *
 * <p>Proposals are ephemeral values. They are produced by collaborators (an
 * operator command, the alert subsystem, a logic process, a schedule), consumed
 * by the priority resolver, and never persisted.</p>
 *
 * <h2>Fields</h2>
 * <ul>
 *   <li>{@code state}     - the requested output level</li>
 *   <li>{@code source}    - producer class; determines {@link #priority()}</li>
 *   <li>{@code origin}    - producer identity within the class (operator name,
 *                           alert id, rule id). Re-submitting with the same
 *                           source and origin replaces the earlier proposal.</li>
 *   <li>{@code reason}    - free text for diagnostics</li>
 *   <li>{@code timestamp} - wall-clock creation time, observational only</li>
 * </ul>
 */
public record StateProposal(
        ActuatorState state,
        ProposalSource source,
        String origin,
        String reason,
        Instant timestamp
)
{
    /**
     * Origin used when a producer does not distinguish instances.
     */
    public static final String ANONYMOUS = "-";

    public StateProposal {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(timestamp, "timestamp");
        origin = origin == null || origin.isBlank() ? ANONYMOUS : origin;
        reason = reason == null ? "" : reason;
    }

    public static StateProposal of(ProposalSource source, ActuatorState state, String reason, Instant timestamp) {
        return new StateProposal(state, source, ANONYMOUS, reason, timestamp);
    }

    /**
     * The synthetic proposal that wins when nothing else is active: off, priority 0.
     */
    public static StateProposal defaultOff(Instant timestamp) {
        return new StateProposal(ActuatorState.OFF, ProposalSource.DEFAULT, ANONYMOUS,
                "no active proposals", timestamp);
    }

    public int priority() {
        return source.priority();
    }
}
