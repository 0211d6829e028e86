package com.questrail.edgecontrol.transport;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.CommandDeliveryException;
import com.questrail.edgecontrol.api.StateProposal;
import com.questrail.edgecontrol.observability.EngineErrorEvent;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.time.Deadlines;
import com.questrail.edgecontrol.time.WallClock;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards authoritative states to the transport.
 *
 * <p>Routing goes through the topology. Failures are reported to the sink and
 * surfaced as a {@link CommandDeliveryException} on the returned future; they
 * are not retried here.</p>
 */
public final class CommandDispatcher {

    private final ActuatorTransport transport;
    private final Topology topology;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;

    public CommandDispatcher(ActuatorTransport transport,
                             Topology topology,
                             WallClock wallClock,
                             EngineObservabilitySink sink) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CompletableFuture<Void> publish(ActuatorRef actuator, StateProposal authoritative) {
        ActuatorCommand command = new ActuatorCommand(
                actuator,
                authoritative.state(),
                authoritative.source(),
                authoritative.reason(),
                wallClock.now());

        CompletableFuture<Void> sent;
        try {
            sent = transport.publish(topology.resolveController(actuator), command);
        } catch (RuntimeException e) {
            sent = CompletableFuture.failedFuture(e);
        }

        return sent.handle((ok, error) -> {
            if (error == null) {
                return null;
            }
            Throwable cause = Deadlines.unwrap(error);
            sink.onError(new EngineErrorEvent(wallClock.now(),
                    "Command delivery failed for " + actuator, cause));
            throw new CommandDeliveryException(actuator, cause);
        });
    }
}
