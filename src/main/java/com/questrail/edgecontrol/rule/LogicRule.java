package com.questrail.edgecontrol.rule;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * LogicRule
 * -----------------------------------------------------------------------------
 * An authored automation rule binding conditions, timer windows and events to
 * the desired state of one actuator.
 *
 * <p>The rule fires when every condition holds, at least one timer window is
 * active and every event is satisfied. An empty category is satisfied
 * vacuously. When it fires the rule proposes {@link #activeState()}; otherwise
 * it proposes off.</p>
 *
 * <p>Rules are immutable. Editing a rule means replacing it, which never
 * affects an evaluation pass already in progress.</p>
 */
public record LogicRule(
        String id,
        String name,
        ActuatorRef actuator,
        List<Condition> conditions,
        List<TimerWindow> timers,
        List<LogicEvent> events,
        ActuatorState activeState,
        boolean enabled,
        boolean failsafeEnabled,
        ActuatorState failsafeState
) {
    public LogicRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(actuator, "actuator");
        Objects.requireNonNull(activeState, "activeState");
        Objects.requireNonNull(failsafeState, "failsafeState");
        name = name == null ? id : name;
        conditions = List.copyOf(conditions);
        timers = List.copyOf(timers);
        events = List.copyOf(events);
    }

    public LogicRule withEnabled(boolean value) {
        return new LogicRule(id, name, actuator, conditions, timers, events, activeState, value,
                failsafeEnabled, failsafeState);
    }

    public static Builder builder(String id, ActuatorRef actuator) {
        return new Builder(id, actuator);
    }

    public static final class Builder {
        private final String id;
        private final ActuatorRef actuator;
        private String name;
        private final List<Condition> conditions = new ArrayList<>();
        private final List<TimerWindow> timers = new ArrayList<>();
        private final List<LogicEvent> events = new ArrayList<>();
        private ActuatorState activeState = ActuatorState.ON;
        private boolean enabled = true;
        private boolean failsafeEnabled = true;
        private ActuatorState failsafeState = ActuatorState.OFF;

        private Builder(String id, ActuatorRef actuator) {
            this.id = id;
            this.actuator = actuator;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder condition(Condition condition) {
            conditions.add(Objects.requireNonNull(condition, "condition"));
            return this;
        }

        public Builder timer(TimerWindow timer) {
            timers.add(Objects.requireNonNull(timer, "timer"));
            return this;
        }

        public Builder event(LogicEvent event) {
            events.add(Objects.requireNonNull(event, "event"));
            return this;
        }

        public Builder activeState(ActuatorState state) {
            this.activeState = state;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder failsafe(boolean enabled, ActuatorState state) {
            this.failsafeEnabled = enabled;
            this.failsafeState = state;
            return this;
        }

        public LogicRule build() {
            return new LogicRule(id, name, actuator, conditions, timers, events, activeState, enabled,
                    failsafeEnabled, failsafeState);
        }
    }
}
