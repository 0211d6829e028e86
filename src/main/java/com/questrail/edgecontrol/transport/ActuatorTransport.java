package com.questrail.edgecontrol.transport;

import com.questrail.edgecontrol.api.SensorRef;
import com.questrail.edgecontrol.api.SensorSample;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * ActuatorTransport
 * =============================================================================
 *
 * Outbound boundary of the engine towards field controllers.
 *
 * <h2>Delivery</h2>
 * Delivery is at-least-once with no ordering across targets. Retries, if any,
 * are the transport's concern; the engine reports a failed future and moves on.
 *
 * <h2>Threading</h2>
 * Sample listeners may be invoked on transport threads. They must be
 * non-blocking.
 */
public interface ActuatorTransport
{
    /**
     * Publishes one command to a controller. The returned future completes when
     * the transport has accepted the command, or exceptionally if it could not.
     */
    CompletableFuture<Void> publish(CommandTarget target, ActuatorCommand command);

    /**
     * Registers a listener for sensor samples pushed by controllers.
     */
    void onSample(Consumer<SensorSample> listener);

    /**
     * Requests the latest sample of a sensor owned by another controller. The
     * future may never complete; callers bound it with a deadline.
     */
    CompletableFuture<Optional<SensorSample>> requestSample(CommandTarget target, SensorRef sensor);
}
