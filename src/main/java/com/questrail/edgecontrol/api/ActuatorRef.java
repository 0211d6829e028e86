package com.questrail.edgecontrol.api;

import java.util.Objects;

/**
 * ActuatorRef
 * -----------------------------------------------------------------------------
 * Identity of one physical output: the field controller that hosts it and the
 * pin it is wired to.
 *
 * <p>This is the key of every per-actuator structure in the engine: active
 * proposals, the resolved state, the running logic process and the safety
 * backups. Two references are equal exactly when controller id and pin are
 * equal; no other metadata takes part in identity.</p>
 */
public record ActuatorRef(String controllerId, int pin)
{
    public ActuatorRef {
        Objects.requireNonNull(controllerId, "controllerId");
        if (controllerId.isBlank()) {
            throw new IllegalArgumentException("controllerId must not be blank");
        }
        if (pin < 0) {
            throw new IllegalArgumentException("pin must be >= 0");
        }
    }

    public static ActuatorRef of(String controllerId, int pin) {
        return new ActuatorRef(controllerId, pin);
    }

    /**
     * Stable textual form, {@code controller:pin}, used for store keys and logs.
     */
    public String key() {
        return controllerId + ":" + pin;
    }

    @Override
    public String toString() {
        return key();
    }
}
