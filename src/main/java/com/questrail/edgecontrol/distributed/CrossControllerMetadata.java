package com.questrail.edgecontrol.distributed;

import java.util.Objects;
import java.util.Set;

/**
 * Every aggregator, zone, subzone and controller a cross-controller rule
 * involves. Used for impact queries; a rule must name at least one
 * aggregator, zone and controller.
 */
public record CrossControllerMetadata(
        Set<String> aggregators,
        Set<String> zones,
        Set<String> subzones,
        Set<String> controllers
) {
    public CrossControllerMetadata {
        aggregators = Set.copyOf(Objects.requireNonNull(aggregators, "aggregators"));
        zones = Set.copyOf(Objects.requireNonNull(zones, "zones"));
        subzones = Set.copyOf(Objects.requireNonNull(subzones, "subzones"));
        controllers = Set.copyOf(Objects.requireNonNull(controllers, "controllers"));
    }

    public void validate() {
        if (aggregators.isEmpty()) {
            throw new IllegalArgumentException("metadata must name at least one aggregator");
        }
        if (zones.isEmpty()) {
            throw new IllegalArgumentException("metadata must name at least one zone");
        }
        if (controllers.isEmpty()) {
            throw new IllegalArgumentException("metadata must name at least one controller");
        }
    }
}
