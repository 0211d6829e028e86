package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.ActuatorRef;

import java.util.Optional;

public record ActionResult(ActuatorRef target, boolean delivered, Optional<String> error) {

    public static ActionResult ok(ActuatorRef target) {
        return new ActionResult(target, true, Optional.empty());
    }

    public static ActionResult failed(ActuatorRef target, Throwable cause) {
        return new ActionResult(target, false, Optional.of(String.valueOf(cause)));
    }
}
