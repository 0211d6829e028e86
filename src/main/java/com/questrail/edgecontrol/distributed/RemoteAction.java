package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;

import java.util.Objects;

public record RemoteAction(ActuatorRef target, ActuatorState state) {

    public RemoteAction {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(state, "state");
    }
}
