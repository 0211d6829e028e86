package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.SensorRef;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.time.Deadlines;
import com.questrail.edgecontrol.time.FetchResult;
import com.questrail.edgecontrol.transport.ActuatorTransport;
import com.questrail.edgecontrol.transport.Topology;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Fetches the latest sample of a sensor owned by another controller, routed
 * through the topology and raced against a fixed per-fetch deadline.
 */
public final class RemoteSampleFetcher {

    private final ActuatorTransport transport;
    private final Topology topology;
    private final Deadlines deadlines;
    private final Duration timeout;

    public RemoteSampleFetcher(ActuatorTransport transport, Topology topology, Deadlines deadlines, Duration timeout) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.topology = Objects.requireNonNull(topology, "topology");
        this.deadlines = Objects.requireNonNull(deadlines, "deadlines");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public CompletableFuture<FetchResult<Optional<SensorSample>>> fetch(SensorRef sensor) {
        return deadlines.fetchWithDeadline(
                () -> transport.requestSample(topology.resolveController(sensor), sensor),
                timeout);
    }
}
