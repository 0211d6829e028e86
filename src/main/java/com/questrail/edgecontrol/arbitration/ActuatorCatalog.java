package com.questrail.edgecontrol.arbitration;

import com.questrail.edgecontrol.api.ActuatorKind;
import com.questrail.edgecontrol.api.ActuatorRef;

import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Kind of each registered actuator. Unregistered actuators are
 * {@link ActuatorKind#UNKNOWN}.
 */
public final class ActuatorCatalog {

    private final ConcurrentMap<ActuatorRef, ActuatorKind> kinds = new ConcurrentHashMap<>();

    public void register(ActuatorRef actuator, ActuatorKind kind) {
        kinds.put(Objects.requireNonNull(actuator, "actuator"), Objects.requireNonNull(kind, "kind"));
    }

    public ActuatorKind kindOf(ActuatorRef actuator) {
        return kinds.getOrDefault(actuator, ActuatorKind.UNKNOWN);
    }
}
