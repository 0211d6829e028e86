package com.questrail.edgecontrol.api;

import java.time.Duration;

/**
 * A logic process evaluation exceeded its bound. Recorded in the process's
 * diagnostic log and routed to the failsafe path; never propagated to the
 * other processes of the same batch.
 */
public final class EvaluationTimeoutException extends EdgeControlException
{
    public EvaluationTimeoutException(ActuatorRef actuator, Duration bound) {
        super("Evaluation of " + actuator + " exceeded " + bound.toMillis() + " ms");
    }
}
