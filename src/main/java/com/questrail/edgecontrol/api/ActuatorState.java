package com.questrail.edgecontrol.api;

/**
 * ActuatorState
 * -----------------------------------------------------------------------------
 * Requested output level of one actuator, normalized to {@code [0, 1]}.
 *
 * <p>Switching actuators (pumps, valves, relays) only ever see {@link #OFF} and
 * {@link #ON}. Dimmable actuators (LEDs, fans) may request intermediate levels;
 * the tie-break for those kinds prefers the numerically highest level.</p>
 */
public record ActuatorState(double level)
{
    public static final ActuatorState OFF = new ActuatorState(0.0);
    public static final ActuatorState ON = new ActuatorState(1.0);

    public ActuatorState {
        if (Double.isNaN(level) || level < 0.0 || level > 1.0) {
            throw new IllegalArgumentException("level must be within [0, 1]: " + level);
        }
    }

    public static ActuatorState of(boolean on) {
        return on ? ON : OFF;
    }

    public static ActuatorState level(double level) {
        return new ActuatorState(level);
    }

    public boolean isOff() {
        return level == 0.0;
    }

    public boolean isOn() {
        return !isOff();
    }
}
