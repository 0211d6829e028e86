package com.questrail.edgecontrol.api;

import java.time.Instant;
import java.util.Objects;

/**
 * ResolvedState
 * -----------------------------------------------------------------------------
 * The authoritative state of one actuator: the proposal that won the most
 * recent resolution, together with how many proposals were active and whether
 * the winner differs from the previous one.
 *
 * <p>Only the arbitration path produces these. The winner's priority is always
 * the maximum priority among the proposals active at that moment, or
 * {@link ProposalSource#DEFAULT} when none were.</p>
 */
public record ResolvedState(
        ActuatorRef actuator,
        StateProposal winner,
        int activeProposals,
        boolean changed,
        Instant resolvedAt
)
{
    public ResolvedState {
        Objects.requireNonNull(actuator, "actuator");
        Objects.requireNonNull(winner, "winner");
        Objects.requireNonNull(resolvedAt, "resolvedAt");
    }

    public ActuatorState state() {
        return winner.state();
    }
}
