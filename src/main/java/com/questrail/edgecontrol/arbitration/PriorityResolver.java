package com.questrail.edgecontrol.arbitration;

import com.questrail.edgecontrol.api.ActuatorKind;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.StateProposal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * PriorityResolver
 * =============================================================================
 *
 * Picks the single authoritative proposal for one actuator.
 *
 * <h2>Rules</h2>
 * <ol>
 *   <li>No proposals: a synthetic {@link ProposalSource#DEFAULT} proposal that
 *       turns the actuator off.</li>
 *   <li>Otherwise the highest {@link ProposalSource#priority()} wins. Source
 *       ordering is fixed: EMERGENCY &gt; MANUAL &gt; ALERT &gt; LOGIC &gt; TIMER
 *       &gt; SCHEDULE &gt; DEFAULT.</li>
 *   <li>Several proposals at that priority are separated by the actuator kind's
 *       {@link ActuatorKind.TieBreak}.</li>
 * </ol>
 *
 * <h2>Purity</h2>
 * This class holds no state. Storing the result is the caller's job
 * ({@link ActuatorArbitrator}).
 */
public final class PriorityResolver {

    public StateProposal resolve(List<StateProposal> proposals, ActuatorKind kind, Instant now) {
        Objects.requireNonNull(proposals, "proposals");
        Objects.requireNonNull(kind, "kind");

        if (proposals.isEmpty()) {
            return StateProposal.defaultOff(now);
        }

        int top = Integer.MIN_VALUE;
        for (StateProposal p : proposals) {
            top = Math.max(top, p.priority());
        }

        List<StateProposal> tied = new ArrayList<>();
        for (StateProposal p : proposals) {
            if (p.priority() == top) {
                tied.add(p);
            }
        }

        if (tied.size() == 1) {
            return tied.get(0);
        }
        return breakTie(tied, kind.tieBreak());
    }

    private static StateProposal breakTie(List<StateProposal> tied, ActuatorKind.TieBreak tieBreak) {
        switch (tieBreak) {
            case PREFER_OFF:
                for (StateProposal p : tied) {
                    if (p.state().isOff()) {
                        return p;
                    }
                }
                return tied.get(0);

            case PREFER_HIGHEST_LEVEL: {
                StateProposal best = tied.get(0);
                for (StateProposal p : tied) {
                    if (p.state().level() > best.state().level()) {
                        best = p;
                    }
                }
                return best;
            }

            case PREFER_LOGIC:
                for (StateProposal p : tied) {
                    if (p.source() == ProposalSource.LOGIC) {
                        return p;
                    }
                }
                return tied.get(0);

            case FIRST_IN_ORDER:
                return tied.get(0);

            default:
                throw new IllegalStateException("Unhandled tie-break: " + tieBreak);
        }
    }
}
