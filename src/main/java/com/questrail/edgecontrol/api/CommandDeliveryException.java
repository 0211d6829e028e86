package com.questrail.edgecontrol.api;

/**
 * An outbound actuator command could not be handed to the transport.
 *
 * <p>The engine logs these and surfaces them to the immediate caller. It never
 * retries; redelivery is the transport's concern.</p>
 */
public final class CommandDeliveryException extends EdgeControlException
{
    private final ActuatorRef target;

    public CommandDeliveryException(ActuatorRef target, Throwable cause) {
        super("Command delivery to " + target + " failed", cause);
        this.target = target;
    }

    public ActuatorRef target() {
        return target;
    }
}
