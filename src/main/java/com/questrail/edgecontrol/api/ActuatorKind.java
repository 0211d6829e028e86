package com.questrail.edgecontrol.api;

/**
 * ActuatorKind
 * -----------------------------------------------------------------------------
 * The physical class of an actuator, used only to break ties between proposals
 * that share the highest priority.
 *
 * <ul>
 *   <li>{@link TieBreak#PREFER_OFF} - pump-like outputs, where "off" is the safe side</li>
 *   <li>{@link TieBreak#PREFER_HIGHEST_LEVEL} - dimmable outputs</li>
 *   <li>{@link TieBreak#PREFER_LOGIC} - heater-like outputs, driven by closed-loop rules</li>
 *   <li>{@link TieBreak#FIRST_IN_ORDER} - everything else</li>
 * </ul>
 */
public enum ActuatorKind
{
    PUMP(TieBreak.PREFER_OFF),
    VALVE(TieBreak.PREFER_OFF),
    LED(TieBreak.PREFER_HIGHEST_LEVEL),
    FAN(TieBreak.PREFER_HIGHEST_LEVEL),
    HEATER(TieBreak.PREFER_LOGIC),
    RELAY(TieBreak.FIRST_IN_ORDER),
    UNKNOWN(TieBreak.FIRST_IN_ORDER);

    public enum TieBreak {
        PREFER_OFF,
        PREFER_HIGHEST_LEVEL,
        PREFER_LOGIC,
        FIRST_IN_ORDER
    }

    private final TieBreak tieBreak;

    ActuatorKind(TieBreak tieBreak) {
        this.tieBreak = tieBreak;
    }

    public TieBreak tieBreak() {
        return tieBreak;
    }
}
