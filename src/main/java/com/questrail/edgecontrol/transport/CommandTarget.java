package com.questrail.edgecontrol.transport;

import java.util.Objects;

/**
 * Routing address of a field controller: the edge aggregator that owns it and
 * the controller itself.
 */
public record CommandTarget(String aggregatorId, String controllerId)
{
    public CommandTarget {
        Objects.requireNonNull(aggregatorId, "aggregatorId");
        Objects.requireNonNull(controllerId, "controllerId");
    }

    @Override
    public String toString() {
        return aggregatorId + "/" + controllerId;
    }
}
