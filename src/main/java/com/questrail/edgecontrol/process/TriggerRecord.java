package com.questrail.edgecontrol.process;

import com.questrail.edgecontrol.api.ActuatorState;

import java.time.Instant;

/**
 * One state flip computed by a logic process.
 */
public record TriggerRecord(Instant at, Transition transition, ActuatorState state, String reason) {

    public enum Transition {
        ACTIVATED,
        DEACTIVATED
    }
}
