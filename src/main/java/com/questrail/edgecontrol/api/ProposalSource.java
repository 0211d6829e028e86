package com.questrail.edgecontrol.api;

/**
 * ProposalSource
 * -----------------------------------------------------------------------------
 * The producer class of a {@link StateProposal}, and with it the proposal's
 * priority.
 *
 * <h2>Fixed ordering</h2>
 * Highest to lowest:
 * <pre>
 *   EMERGENCY(100) > MANUAL(90) > ALERT(80) > LOGIC(70) > TIMER(60) > SCHEDULE(50) > DEFAULT(0)
 * </pre>
 * The ordering is a hard safety invariant. It is encoded here, once, and the
 * priority of a proposal is always derived from its source; there is no way to
 * construct a proposal whose priority disagrees with its source.
 *
 * <h2>Why an enum</h2>
 * A closed set makes an unrecognized source a compile-time problem instead of
 * a silent fall-through to the lowest priority.
 */
public enum ProposalSource
{
    EMERGENCY(100),
    MANUAL(90),
    ALERT(80),
    LOGIC(70),
    TIMER(60),
    SCHEDULE(50),
    DEFAULT(0);

    private final int priority;

    ProposalSource(int priority) {
        this.priority = priority;
    }

    public int priority() {
        return priority;
    }
}
