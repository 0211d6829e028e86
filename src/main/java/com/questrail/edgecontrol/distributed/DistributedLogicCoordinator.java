package com.questrail.edgecontrol.distributed;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.CapacityExceededException;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.ResolvedState;
import com.questrail.edgecontrol.api.RuleUnavailableException;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.api.StateProposal;
import com.questrail.edgecontrol.arbitration.ActuatorArbitrator;
import com.questrail.edgecontrol.evaluation.ConditionEvaluator;
import com.questrail.edgecontrol.evaluation.ConditionOutcome;
import com.questrail.edgecontrol.failsafe.FailsafeCoordinator;
import com.questrail.edgecontrol.failsafe.StatePublisher;
import com.questrail.edgecontrol.observability.EngineErrorEvent;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.rule.Condition;
import com.questrail.edgecontrol.time.Deadlines;
import com.questrail.edgecontrol.time.FetchResult;
import com.questrail.edgecontrol.time.WallClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * DistributedLogicCoordinator
 * =============================================================================
 *
 * Registry and evaluator of {@link CrossControllerRule}s.
 *
 * <h2>Evaluation</h2>
 * <ul>
 *   <li>Every trigger and condition fetches its sensor concurrently, each
 *       raced against the per-fetch deadline. A timeout yields an inactive
 *       {@link SignalResult.Reason#TIMEOUT} result and never blocks the
 *       others.</li>
 *   <li>Fetched readings pass the same data-quality gate and operators as
 *       local conditions. An empty answer is decided by the condition's
 *       fallback strategy.</li>
 *   <li>When every result is active, each action is submitted to arbitration
 *       as a LOGIC proposal and published on its own; one failed delivery
 *       does not undo the others.</li>
 *   <li>A failed fetch or any exception while evaluating makes the run
 *       untrustworthy: the rule's failsafe state is applied to every action
 *       target when the rule allows it.</li>
 * </ul>
 *
 * <h2>Registry</h2>
 * Holds at most the configured number of rules; creating one more is rejected
 * with {@link CapacityExceededException}.
 */
public final class DistributedLogicCoordinator {

    private final Object lock = new Object();
    private final Map<String, CrossControllerRule> rules = new LinkedHashMap<>();

    private final int capacity;
    private final RemoteSampleFetcher fetcher;
    private final ConditionEvaluator conditions;
    private final ActuatorArbitrator arbitrator;
    private final StatePublisher publisher;
    private final FailsafeCoordinator failsafe;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;

    public DistributedLogicCoordinator(int capacity,
                                       RemoteSampleFetcher fetcher,
                                       ConditionEvaluator conditions,
                                       ActuatorArbitrator arbitrator,
                                       StatePublisher publisher,
                                       FailsafeCoordinator failsafe,
                                       WallClock wallClock,
                                       EngineObservabilitySink sink) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.capacity = capacity;
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.conditions = Objects.requireNonNull(conditions, "conditions");
        this.arbitrator = Objects.requireNonNull(arbitrator, "arbitrator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.failsafe = Objects.requireNonNull(failsafe, "failsafe");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    // ---------------------------------------------------------------------
    // Registry
    // ---------------------------------------------------------------------

    public void create(CrossControllerRule rule) {
        Objects.requireNonNull(rule, "rule");
        rule.metadata().validate();
        synchronized (lock) {
            if (!rules.containsKey(rule.id()) && rules.size() >= capacity) {
                throw new CapacityExceededException(capacity);
            }
            rules.put(rule.id(), rule);
        }
    }

    /**
     * Removes the rule and withdraws the proposals it submitted. Completes once
     * every changed actuator has been published.
     */
    public CompletableFuture<Void> remove(String ruleId) {
        CrossControllerRule removed;
        synchronized (lock) {
            removed = rules.remove(ruleId);
        }
        if (removed == null) {
            return CompletableFuture.completedFuture(null);
        }

        List<CompletableFuture<Void>> withdrawals = new ArrayList<>();
        for (ActuatorRef target : removed.actionTargets()) {
            ResolvedState resolved = arbitrator.clear(target, ProposalSource.LOGIC, ruleId);
            if (resolved.changed()) {
                withdrawals.add(publisher.publish(resolved));
            }
        }
        return CompletableFuture.allOf(withdrawals.toArray(new CompletableFuture<?>[0]));
    }

    public Optional<CrossControllerRule> get(String ruleId) {
        synchronized (lock) {
            return Optional.ofNullable(rules.get(ruleId));
        }
    }

    public List<CrossControllerRule> all() {
        synchronized (lock) {
            return List.copyOf(rules.values());
        }
    }

    public List<CrossControllerRule> rulesTouchingZone(String zone) {
        return select(r -> r.metadata().zones().contains(zone));
    }

    public List<CrossControllerRule> rulesTouchingSubzone(String subzone) {
        return select(r -> r.metadata().subzones().contains(subzone));
    }

    public List<CrossControllerRule> rulesTouchingDevice(String controllerId, int pin) {
        return select(r -> r.touchesDevice(controllerId, pin));
    }

    /**
     * Rule ids per zone, zones in natural order.
     */
    public Map<String, List<String>> zoneIndex() {
        Map<String, List<String>> index = new TreeMap<>();
        for (CrossControllerRule rule : all()) {
            for (String zone : rule.metadata().zones()) {
                index.computeIfAbsent(zone, z -> new ArrayList<>()).add(rule.id());
            }
        }
        return index;
    }

    private List<CrossControllerRule> select(Predicate<CrossControllerRule> filter) {
        List<CrossControllerRule> out = new ArrayList<>();
        for (CrossControllerRule rule : all()) {
            if (filter.test(rule)) {
                out.add(rule);
            }
        }
        return out;
    }

    // ---------------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------------

    public CompletableFuture<DistributedEvaluation> evaluateDistributed(String ruleId) {
        Optional<CrossControllerRule> rule = get(ruleId);
        if (rule.isEmpty()) {
            return CompletableFuture.failedFuture(new RuleUnavailableException("Cross-controller rule not found: " + ruleId));
        }
        return evaluateDistributed(rule.get());
    }

    public CompletableFuture<DistributedEvaluation> evaluateDistributed(CrossControllerRule rule) {
        Objects.requireNonNull(rule, "rule");

        CompletableFuture<DistributedEvaluation> evaluation;
        try {
            List<CompletableFuture<SignalResult>> pending = new ArrayList<>();
            for (int i = 0; i < rule.triggers().size(); i++) {
                pending.add(signal(SignalResult.Role.TRIGGER, i, rule.triggers().get(i)));
            }
            for (int i = 0; i < rule.conditions().size(); i++) {
                pending.add(signal(SignalResult.Role.CONDITION, i, rule.conditions().get(i)));
            }

            evaluation = CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                    .thenCompose(ignored -> {
                        List<SignalResult> results = new ArrayList<>(pending.size());
                        for (CompletableFuture<SignalResult> f : pending) {
                            results.add(f.join());
                        }
                        return conclude(rule, results);
                    });
        } catch (RuntimeException e) {
            evaluation = CompletableFuture.failedFuture(e);
        }

        return evaluation
                .handle((result, error) -> error == null
                        ? CompletableFuture.completedFuture(result)
                        : failsafeAll(rule, List.of(), "evaluation failed: " + Deadlines.unwrap(error)))
                .thenCompose(Function.identity());
    }

    /**
     * Evaluates every enabled rule concurrently.
     */
    public CompletableFuture<List<DistributedEvaluation>> evaluateEnabled() {
        List<CompletableFuture<DistributedEvaluation>> runs = new ArrayList<>();
        for (CrossControllerRule rule : all()) {
            if (rule.enabled()) {
                runs.add(evaluateDistributed(rule));
            }
        }
        return CompletableFuture.allOf(runs.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<DistributedEvaluation> out = new ArrayList<>(runs.size());
                    for (CompletableFuture<DistributedEvaluation> run : runs) {
                        out.add(run.join());
                    }
                    return out;
                });
    }

    private CompletableFuture<SignalResult> signal(SignalResult.Role role, int index, Condition condition) {
        return fetcher.fetch(condition.sensor()).thenApply(result -> {
            if (result instanceof FetchResult.Completed<Optional<SensorSample>> completed) {
                Optional<SensorSample> sample = completed.value() == null ? Optional.empty() : completed.value();
                ConditionOutcome outcome = conditions.evaluate(condition, sample, wallClock.now());
                if (sample.isEmpty()) {
                    // the condition's fallback decides, as for a missing local sample
                    return new SignalResult(role, index, condition.sensor(), outcome.result(),
                            SignalResult.Reason.SENSOR_UNAVAILABLE);
                }
                SignalResult.Reason reason = outcome.fellBack()
                        ? SignalResult.Reason.DATA_QUALITY_FALLBACK
                        : outcome.result() ? SignalResult.Reason.CONDITION_MET : SignalResult.Reason.CONDITION_NOT_MET;
                return new SignalResult(role, index, condition.sensor(), outcome.result(), reason);
            }
            if (result.isTimedOut()) {
                return new SignalResult(role, index, condition.sensor(), false, SignalResult.Reason.TIMEOUT);
            }
            return new SignalResult(role, index, condition.sensor(), false, SignalResult.Reason.EVALUATION_ERROR);
        });
    }

    private CompletableFuture<DistributedEvaluation> conclude(CrossControllerRule rule, List<SignalResult> results) {
        for (SignalResult r : results) {
            if (r.reason() == SignalResult.Reason.EVALUATION_ERROR) {
                return failsafeAll(rule, results,
                        "fetch of " + r.sensor() + " for " + r.role() + " " + r.index() + " failed");
            }
        }

        boolean fired = rule.enabled() && results.stream().allMatch(SignalResult::active);
        if (!fired) {
            return CompletableFuture.completedFuture(
                    new DistributedEvaluation(rule.id(), false, results, List.of(), false, Optional.empty()));
        }
        return dispatchActions(rule, results);
    }

    private CompletableFuture<DistributedEvaluation> dispatchActions(CrossControllerRule rule,
                                                                     List<SignalResult> results) {
        Instant now = wallClock.now();
        List<CompletableFuture<ActionResult>> deliveries = new ArrayList<>();
        for (RemoteAction action : rule.actions()) {
            ActuatorRef target = action.target();
            CompletableFuture<ActionResult> delivery;
            try {
                ResolvedState resolved = arbitrator.submit(target, new StateProposal(action.state(),
                        ProposalSource.LOGIC, rule.id(), "cross-controller rule " + rule.id(), now));
                CompletableFuture<Void> sent = resolved.changed()
                        ? publisher.publish(resolved)
                        : CompletableFuture.completedFuture(null);
                delivery = sent.handle((ignored, error) -> error == null
                        ? ActionResult.ok(target)
                        : ActionResult.failed(target, Deadlines.unwrap(error)));
            } catch (RuntimeException e) {
                sink.onError(new EngineErrorEvent(now, "Dispatching action to " + target + " failed", e));
                delivery = CompletableFuture.completedFuture(ActionResult.failed(target, e));
            }
            deliveries.add(delivery);
        }

        return collect(deliveries).thenApply(actions ->
                new DistributedEvaluation(rule.id(), true, results, actions, false, Optional.empty()));
    }

    private CompletableFuture<DistributedEvaluation> failsafeAll(CrossControllerRule rule,
                                                                 List<SignalResult> results,
                                                                 String reason) {
        sink.onError(new EngineErrorEvent(wallClock.now(),
                "Cross-controller rule " + rule.id() + " untrustworthy: " + reason, null));

        if (!rule.failsafeEnabled()) {
            return CompletableFuture.completedFuture(
                    new DistributedEvaluation(rule.id(), false, results, List.of(), false, Optional.of(reason)));
        }

        List<CompletableFuture<ActionResult>> forced = new ArrayList<>();
        for (ActuatorRef target : rule.actionTargets()) {
            forced.add(failsafe.activate(target, rule.failsafeState(), rule.id(), reason)
                    .handle((ignored, error) -> error == null
                            ? ActionResult.ok(target)
                            : ActionResult.failed(target, Deadlines.unwrap(error))));
        }
        return collect(forced).thenApply(actions ->
                new DistributedEvaluation(rule.id(), false, results, actions, true, Optional.of(reason)));
    }

    private static CompletableFuture<List<ActionResult>> collect(List<CompletableFuture<ActionResult>> pending) {
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<ActionResult> out = new ArrayList<>(pending.size());
                    for (CompletableFuture<ActionResult> f : pending) {
                        out.add(f.join());
                    }
                    return out;
                });
    }
}
