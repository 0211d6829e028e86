package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.rule.Condition;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Rule whose triggers, conditions and actions may each live on a different
 * controller.
 *
 * <p>Triggers and conditions aggregate the same way: the rule fires when every
 * one of them holds. When it fires, every action is dispatched to its own
 * target independently.</p>
 */
public record CrossControllerRule(
        String id,
        String name,
        List<Condition> triggers,
        List<Condition> conditions,
        List<RemoteAction> actions,
        boolean enabled,
        boolean failsafeEnabled,
        ActuatorState failsafeState,
        CrossControllerMetadata metadata
) {
    public CrossControllerRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(failsafeState, "failsafeState");
        Objects.requireNonNull(metadata, "metadata");
        name = name == null ? id : name;
        triggers = List.copyOf(triggers);
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
    }

    /**
     * Distinct action targets in declaration order.
     */
    public Set<ActuatorRef> actionTargets() {
        Set<ActuatorRef> targets = new LinkedHashSet<>();
        for (RemoteAction action : actions) {
            targets.add(action.target());
        }
        return targets;
    }

    public boolean touchesDevice(String controllerId, int pin) {
        for (Condition c : triggers) {
            if (c.sensor().controllerId().equals(controllerId) && c.sensor().pin() == pin) {
                return true;
            }
        }
        for (Condition c : conditions) {
            if (c.sensor().controllerId().equals(controllerId) && c.sensor().pin() == pin) {
                return true;
            }
        }
        for (RemoteAction a : actions) {
            if (a.target().controllerId().equals(controllerId) && a.target().pin() == pin) {
                return true;
            }
        }
        return false;
    }
}
