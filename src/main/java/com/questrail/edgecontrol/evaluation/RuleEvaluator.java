package com.questrail.edgecontrol.evaluation;

import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.rule.Condition;
import com.questrail.edgecontrol.rule.LogicEvent;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.rule.TimerWindow;
import com.questrail.edgecontrol.time.WallClock;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Combines conditions, timer windows and events of a rule into one verdict.
 *
 * <p>Samples are resolved by the caller, local or remote, and passed in the
 * order of {@link LogicRule#conditions()}. Disabled timer windows are ignored;
 * a rule whose windows are all disabled has no timer restriction.</p>
 */
public final class RuleEvaluator {

    private final ConditionEvaluator conditions;
    private final EventLedger events;
    private final WallClock wallClock;
    private final ZoneId zone;

    public RuleEvaluator(ConditionEvaluator conditions, EventLedger events, WallClock wallClock, ZoneId zone) {
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.events = Objects.requireNonNull(events, "events");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public RuleVerdict evaluate(LogicRule rule,
                                List<Optional<SensorSample>> samples,
                                List<Optional<Boolean>> lastValid) {
        if (samples.size() != rule.conditions().size() || lastValid.size() != rule.conditions().size()) {
            throw new IllegalArgumentException("expected one sample and one last-valid entry per condition");
        }

        Instant now = wallClock.now();

        List<ConditionOutcome> outcomes = new ArrayList<>(rule.conditions().size());
        int firstFailed = -1;
        for (int i = 0; i < rule.conditions().size(); i++) {
            Condition condition = rule.conditions().get(i);
            ConditionOutcome outcome = conditions.evaluate(condition, samples.get(i), lastValid.get(i), now);
            outcomes.add(outcome);
            if (!outcome.result() && firstFailed < 0) {
                firstFailed = i;
            }
        }
        boolean conditionsMet = firstFailed < 0;

        boolean timersActive = timersActive(rule.timers(), LocalDateTime.ofInstant(now, zone));

        String unsatisfiedEvent = null;
        for (LogicEvent event : rule.events()) {
            if (!events.isSatisfied(event, now)) {
                unsatisfiedEvent = event.name();
                break;
            }
        }
        boolean eventsActive = unsatisfiedEvent == null;

        String reason;
        if (!conditionsMet) {
            Condition failed = rule.conditions().get(firstFailed);
            reason = "condition " + failed.sensor() + " " + failed.operator().symbol() + " "
                    + failed.threshold() + " not met (" + outcomes.get(firstFailed).quality() + ")";
        } else if (!timersActive) {
            reason = "no timer window active";
        } else if (!eventsActive) {
            reason = "event " + unsatisfiedEvent + " not satisfied";
        } else {
            reason = "all conditions met";
        }

        return new RuleVerdict(conditionsMet && timersActive && eventsActive,
                conditionsMet, timersActive, eventsActive, outcomes, reason);
    }

    static boolean timersActive(List<TimerWindow> timers, LocalDateTime localNow) {
        boolean anyEnabled = false;
        for (TimerWindow timer : timers) {
            if (!timer.enabled()) {
                continue;
            }
            anyEnabled = true;
            if (timer.isActiveAt(localNow)) {
                return true;
            }
        }
        return !anyEnabled;
    }
}
