package com.questrail.edgecontrol.core;

import com.questrail.edgecontrol.api.ActuatorKind;
import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.EdgeControlEngine;
import com.questrail.edgecontrol.api.ProcessStats;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.ResolvedState;
import com.questrail.edgecontrol.api.RuleUnavailableException;
import com.questrail.edgecontrol.api.SensorSample;
import com.questrail.edgecontrol.api.StateProposal;
import com.questrail.edgecontrol.arbitration.ActuatorArbitrator;
import com.questrail.edgecontrol.arbitration.ActuatorCatalog;
import com.questrail.edgecontrol.arbitration.PriorityResolver;
import com.questrail.edgecontrol.config.EngineConfig;
import com.questrail.edgecontrol.distributed.CrossControllerRule;
import com.questrail.edgecontrol.distributed.DistributedEvaluation;
import com.questrail.edgecontrol.distributed.DistributedLogicCoordinator;
import com.questrail.edgecontrol.distributed.RemoteSampleFetcher;
import com.questrail.edgecontrol.evaluation.ConditionEvaluator;
import com.questrail.edgecontrol.evaluation.EventLedger;
import com.questrail.edgecontrol.evaluation.RuleEvaluator;
import com.questrail.edgecontrol.evaluation.SampleCache;
import com.questrail.edgecontrol.failsafe.FailsafeCoordinator;
import com.questrail.edgecontrol.failsafe.KeyValueStore;
import com.questrail.edgecontrol.failsafe.StateBackup;
import com.questrail.edgecontrol.failsafe.StatePublisher;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.process.LogicProcess;
import com.questrail.edgecontrol.process.ProcessStore;
import com.questrail.edgecontrol.process.RuleRegistry;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.scheduling.EvaluationScheduler;
import com.questrail.edgecontrol.scheduling.ProcessEvaluator;
import com.questrail.edgecontrol.scheduling.TickReport;
import com.questrail.edgecontrol.time.Deadlines;
import com.questrail.edgecontrol.time.MonotonicClock;
import com.questrail.edgecontrol.time.MonotonicScheduler;
import com.questrail.edgecontrol.time.WallClock;
import com.questrail.edgecontrol.transport.ActuatorTransport;
import com.questrail.edgecontrol.transport.CommandDispatcher;
import com.questrail.edgecontrol.transport.Topology;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * DefaultEdgeControlEngine
 * =============================================================================
 * Reference implementation of {@link EdgeControlEngine}.
 *
 * <p>Owns one instance of every store; nothing is global, so several engines
 * may coexist in one JVM. The engine does not start any thread of its own:
 * the cadence of {@link #runEvaluationPass()} belongs to the runtime.</p>
 *
 * <p>Publishing of changed states is asynchronous. Delivery failures are
 * reported by the {@link CommandDispatcher} and do not fail the call that
 * caused them.</p>
 */
public final class DefaultEdgeControlEngine implements EdgeControlEngine {

    private final ActuatorCatalog catalog;
    private final ActuatorArbitrator arbitrator;
    private final RuleRegistry rules;
    private final ProcessStore processes;
    private final SampleCache samples;
    private final EventLedger events;
    private final StatePublisher publisher;
    private final FailsafeCoordinator failsafe;
    private final EvaluationScheduler scheduler;
    private final DistributedLogicCoordinator distributed;
    private final WallClock wallClock;

    private DefaultEdgeControlEngine(ActuatorCatalog catalog,
                                     ActuatorArbitrator arbitrator,
                                     RuleRegistry rules,
                                     ProcessStore processes,
                                     SampleCache samples,
                                     EventLedger events,
                                     StatePublisher publisher,
                                     FailsafeCoordinator failsafe,
                                     EvaluationScheduler scheduler,
                                     DistributedLogicCoordinator distributed,
                                     WallClock wallClock) {
        this.catalog = catalog;
        this.arbitrator = arbitrator;
        this.rules = rules;
        this.processes = processes;
        this.samples = samples;
        this.events = events;
        this.publisher = publisher;
        this.failsafe = failsafe;
        this.scheduler = scheduler;
        this.distributed = distributed;
        this.wallClock = wallClock;
    }

    /**
     * Wires a complete engine around the given collaborators.
     */
    public static DefaultEdgeControlEngine create(EngineConfig config,
                                                  ActuatorTransport transport,
                                                  Topology topology,
                                                  KeyValueStore backupStore,
                                                  MonotonicClock clock,
                                                  MonotonicScheduler timeScheduler,
                                                  WallClock wallClock,
                                                  EngineObservabilitySink sink) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(topology, "topology");
        Objects.requireNonNull(backupStore, "backupStore");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(timeScheduler, "timeScheduler");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(sink, "sink");

        // 1. Arbitration
        ActuatorCatalog catalog = new ActuatorCatalog();
        ActuatorArbitrator arbitrator = new ActuatorArbitrator(new PriorityResolver(), catalog,
                config.limits().resolvedStates(), wallClock, sink);

        // 2. Outbound path and backups
        CommandDispatcher dispatcher = new CommandDispatcher(transport, topology, wallClock, sink);
        FailsafeCoordinator failsafe = new FailsafeCoordinator(dispatcher, backupStore, config.backups(),
                wallClock, sink);
        StatePublisher publisher = new StatePublisher(dispatcher, failsafe);

        // 3. Evaluation
        Deadlines deadlines = new Deadlines(timeScheduler, clock);
        SampleCache samples = new SampleCache(config.limits().sampleCache());
        EventLedger events = new EventLedger();
        ConditionEvaluator conditions = new ConditionEvaluator(config.dataQuality());
        RuleEvaluator ruleEvaluator = new RuleEvaluator(conditions, events, wallClock, config.zone());
        RemoteSampleFetcher fetcher = new RemoteSampleFetcher(transport, topology, deadlines,
                config.evaluation().remoteFetchTimeout());

        // 4. Processes and scheduling
        RuleRegistry rules = new RuleRegistry();
        // A process leaving the store, stopped or replaced, withdraws its rule's proposal.
        ProcessStore processes = new ProcessStore(config.limits(), wallClock, sink, stopped -> {
            ResolvedState withdrawn = arbitrator.clear(stopped.actuator(), ProposalSource.LOGIC, stopped.ruleId());
            if (withdrawn.changed()) {
                publisher.publish(withdrawn);
            }
        });
        EvaluationScheduler scheduler = new EvaluationScheduler(
                processes,
                new ProcessEvaluator(ruleEvaluator, samples, fetcher),
                arbitrator,
                publisher,
                failsafe,
                deadlines,
                config.evaluation(),
                wallClock,
                sink);

        // 5. Cross-controller rules
        DistributedLogicCoordinator distributed = new DistributedLogicCoordinator(
                config.limits().crossControllerRules(),
                fetcher,
                conditions,
                arbitrator,
                publisher,
                failsafe,
                wallClock,
                sink);

        return new DefaultEdgeControlEngine(catalog, arbitrator, rules, processes, samples, events,
                publisher, failsafe, scheduler, distributed, wallClock);
    }

    // ---------------------------------------------------------------------
    // Arbitration
    // ---------------------------------------------------------------------

    @Override
    public void registerActuator(ActuatorRef actuator, ActuatorKind kind) {
        catalog.register(actuator, kind);
    }

    @Override
    public ResolvedState submitProposal(ActuatorRef actuator, StateProposal proposal) {
        return publishIfChanged(arbitrator.submit(actuator, proposal));
    }

    @Override
    public ResolvedState clearProposals(ActuatorRef actuator, ProposalSource source) {
        return publishIfChanged(arbitrator.clear(actuator, source));
    }

    @Override
    public ResolvedState clearProposal(ActuatorRef actuator, ProposalSource source, String origin) {
        return publishIfChanged(arbitrator.clear(actuator, source, origin));
    }

    @Override
    public Optional<StateProposal> getResolvedState(ActuatorRef actuator) {
        return arbitrator.resolved(actuator);
    }

    private ResolvedState publishIfChanged(ResolvedState resolved) {
        if (resolved.changed()) {
            publisher.publish(resolved);
        }
        return resolved;
    }

    // ---------------------------------------------------------------------
    // Logic processes
    // ---------------------------------------------------------------------

    @Override
    public void registerRule(LogicRule rule) {
        rules.put(rule);
    }

    @Override
    public LogicProcess startProcess(LogicRule rule) {
        if (rule != null) {
            rules.put(rule);
        }
        return processes.start(rule);
    }

    @Override
    public LogicProcess startProcess(String ruleId) {
        LogicRule rule = rules.get(ruleId)
                .orElseThrow(() -> new RuleUnavailableException("Rule not found: " + ruleId));
        return processes.start(rule);
    }

    @Override
    public boolean stopProcess(ActuatorRef actuator) {
        return processes.stop(actuator).isPresent();
    }

    @Override
    public boolean deleteRule(String ruleId) {
        boolean existed = rules.remove(ruleId).isPresent();
        for (LogicProcess process : processes.byRule(ruleId)) {
            stopProcess(process.actuator());
            existed = true;
        }
        return existed;
    }

    @Override
    public Optional<LogicProcess> getProcess(ActuatorRef actuator) {
        return processes.get(actuator);
    }

    @Override
    public ProcessStats getProcessStats() {
        return scheduler.stats();
    }

    @Override
    public CompletableFuture<TickReport> runEvaluationPass() {
        return scheduler.runTick();
    }

    // ---------------------------------------------------------------------
    // Inputs
    // ---------------------------------------------------------------------

    @Override
    public void acceptSample(SensorSample sample) {
        samples.accept(Objects.requireNonNull(sample, "sample"));
    }

    @Override
    public void signalEvent(String name) {
        events.signal(name, wallClock.now());
    }

    // ---------------------------------------------------------------------
    // Failsafe
    // ---------------------------------------------------------------------

    @Override
    public CompletableFuture<Void> activateFailsafe(ActuatorRef actuator, ActuatorState safeState) {
        return failsafe.activate(actuator, safeState);
    }

    @Override
    public CompletableFuture<Optional<StateBackup>> restore(ActuatorRef actuator) {
        return failsafe.restore(actuator);
    }

    // ---------------------------------------------------------------------
    // Cross-controller rules
    // ---------------------------------------------------------------------

    @Override
    public void createCrossControllerRule(CrossControllerRule rule) {
        distributed.create(rule);
    }

    @Override
    public CompletableFuture<Void> deleteCrossControllerRule(String ruleId) {
        return distributed.remove(ruleId);
    }

    @Override
    public CompletableFuture<DistributedEvaluation> evaluateDistributed(String ruleId) {
        return distributed.evaluateDistributed(ruleId);
    }

    @Override
    public List<CrossControllerRule> rulesTouchingZone(String zone) {
        return distributed.rulesTouchingZone(zone);
    }

    @Override
    public List<CrossControllerRule> rulesTouchingSubzone(String subzone) {
        return distributed.rulesTouchingSubzone(subzone);
    }

    @Override
    public List<CrossControllerRule> rulesTouchingDevice(String controllerId, int pin) {
        return distributed.rulesTouchingDevice(controllerId, pin);
    }

    /**
     * Evaluates every enabled cross-controller rule. Driven by the runtime
     * alongside {@link #runEvaluationPass()}.
     */
    public CompletableFuture<List<DistributedEvaluation>> evaluateCrossControllerRules() {
        return distributed.evaluateEnabled();
    }

    public EvaluationScheduler scheduler() {
        return scheduler;
    }
}
