package com.questrail.edgecontrol.transport;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.SensorRef;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Topology backed by a fixed controller-to-aggregator table. Controllers not
 * listed belong to the local aggregator. A sensor naming an aggregator
 * explicitly is routed through that aggregator.
 */
public final class StaticTopology implements Topology {

    private final String localAggregatorId;
    private final Map<String, String> aggregatorByController;

    public StaticTopology(String localAggregatorId, Map<String, String> aggregatorByController) {
        this.localAggregatorId = Objects.requireNonNull(localAggregatorId, "localAggregatorId");
        this.aggregatorByController = Map.copyOf(aggregatorByController);
    }

    public static StaticTopology local(String localAggregatorId) {
        return new StaticTopology(localAggregatorId, Map.of());
    }

    public StaticTopology withController(String controllerId, String aggregatorId) {
        Map<String, String> copy = new HashMap<>(aggregatorByController);
        copy.put(controllerId, aggregatorId);
        return new StaticTopology(localAggregatorId, copy);
    }

    @Override
    public CommandTarget resolveController(ActuatorRef actuator) {
        return new CommandTarget(aggregatorOf(actuator.controllerId()), actuator.controllerId());
    }

    @Override
    public CommandTarget resolveController(SensorRef sensor) {
        String aggregator = sensor.aggregator().orElseGet(() -> aggregatorOf(sensor.controllerId()));
        return new CommandTarget(aggregator, sensor.controllerId());
    }

    private String aggregatorOf(String controllerId) {
        return aggregatorByController.getOrDefault(controllerId, localAggregatorId);
    }
}
