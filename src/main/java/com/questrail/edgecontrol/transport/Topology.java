package com.questrail.edgecontrol.transport;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.SensorRef;

/**
 * Resolves devices to the controller address that routes to them.
 */
public interface Topology
{
    CommandTarget resolveController(ActuatorRef actuator);

    CommandTarget resolveController(SensorRef sensor);
}
