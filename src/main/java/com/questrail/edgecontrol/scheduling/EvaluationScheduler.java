package com.questrail.edgecontrol.scheduling;

import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.ProcessStats;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.ResolvedState;
import com.questrail.edgecontrol.api.StateProposal;
import com.questrail.edgecontrol.arbitration.ActuatorArbitrator;
import com.questrail.edgecontrol.config.EvaluationPolicy;
import com.questrail.edgecontrol.evaluation.RuleVerdict;
import com.questrail.edgecontrol.failsafe.FailsafeCoordinator;
import com.questrail.edgecontrol.failsafe.StatePublisher;
import com.questrail.edgecontrol.observability.EngineErrorEvent;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.observability.ProcessEvent;
import com.questrail.edgecontrol.observability.ProcessEventType;
import com.questrail.edgecontrol.observability.SchedulerEvent;
import com.questrail.edgecontrol.process.LogicProcess;
import com.questrail.edgecontrol.process.ProcessStore;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.time.Deadlines;
import com.questrail.edgecontrol.time.FetchResult;
import com.questrail.edgecontrol.time.MonotonicClock;
import com.questrail.edgecontrol.time.WallClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * EvaluationScheduler
 * =============================================================================
 *
 * Runs every running logic process once per pass.
 *
 * <h2>Pass</h2>
 * <ol>
 *   <li>At most one pass runs at a time. A pass requested while another is in
 *       flight is skipped, not queued, and counted as a prevented race.</li>
 *   <li>Running processes are snapshotted and ordered by descending resolved
 *       priority of their actuator, then oldest evaluation first.</li>
 *   <li>The snapshot is cut into batches of {@link EvaluationPolicy#batchSize()}.
 *       Batches run one after another with {@link EvaluationPolicy#batchPause()}
 *       between them; inside a batch at most {@link EvaluationPolicy#maxInFlight()}
 *       evaluations are outstanding.</li>
 *   <li>Each evaluation is bounded by {@link EvaluationPolicy#evaluationTimeout()}
 *       and handled on its own. A timeout or error records a diagnostic and,
 *       if the rule allows it, activates failsafe. It never affects siblings.</li>
 *   <li>A computed flip becomes a LOGIC proposal (origin = rule id) submitted
 *       to arbitration. The winner is published when it changed.</li>
 * </ol>
 *
 * <h2>Stopped processes</h2>
 * A process stopped while its evaluation is in flight finishes, but its result
 * is discarded. The proposal is submitted under the process store's lock, so a
 * stop racing the submit always withdraws what was submitted.
 */
public final class EvaluationScheduler {

    private final Semaphore runLock = new Semaphore(1);

    private final ProcessStore processes;
    private final ProcessEvaluator evaluator;
    private final ActuatorArbitrator arbitrator;
    private final StatePublisher publisher;
    private final FailsafeCoordinator failsafe;
    private final Deadlines deadlines;
    private final EvaluationPolicy policy;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;

    private final Object statsLock = new Object();
    private long totalEvaluations;
    private double meanEvaluationMs;
    private final Set<String> slowRuleIds = ConcurrentHashMap.newKeySet();
    private final AtomicLong batchCount = new AtomicLong();
    private volatile double lastBatchMs;
    private final AtomicLong preventedRaces = new AtomicLong();

    public EvaluationScheduler(ProcessStore processes,
                               ProcessEvaluator evaluator,
                               ActuatorArbitrator arbitrator,
                               StatePublisher publisher,
                               FailsafeCoordinator failsafe,
                               Deadlines deadlines,
                               EvaluationPolicy policy,
                               WallClock wallClock,
                               EngineObservabilitySink sink) {
        this.processes = Objects.requireNonNull(processes, "processes");
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.arbitrator = Objects.requireNonNull(arbitrator, "arbitrator");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.failsafe = Objects.requireNonNull(failsafe, "failsafe");
        this.deadlines = Objects.requireNonNull(deadlines, "deadlines");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CompletableFuture<TickReport> runTick() {
        if (!runLock.tryAcquire()) {
            long skipped = preventedRaces.incrementAndGet();
            sink.onSchedulerEvent(new SchedulerEvent(wallClock.now(), SchedulerEvent.Type.PASS_SKIPPED,
                    "previous pass still running (" + skipped + " skipped so far)"));
            return CompletableFuture.completedFuture(TickReport.skippedPass());
        }

        MonotonicClock clock = deadlines.clock();
        long started = clock.nowNanos();
        Pass pass = new Pass();

        CompletableFuture<Void> chain;
        try {
            List<List<LogicProcess>> batches = partition(order(processes.running()), policy.batchSize());
            chain = CompletableFuture.completedFuture(null);
            for (int i = 0; i < batches.size(); i++) {
                List<LogicProcess> batch = batches.get(i);
                boolean first = i == 0;
                chain = chain
                        .thenCompose(ignored -> first
                                ? CompletableFuture.<Void>completedFuture(null)
                                : deadlines.pause(policy.batchPause()))
                        .thenCompose(ignored -> runBatch(batch, pass));
            }
        } catch (RuntimeException e) {
            chain = CompletableFuture.failedFuture(e);
        }

        return chain.handle((ignored, error) -> {
            runLock.release();
            double durationMs = (clock.nowNanos() - started) / 1_000_000.0;
            if (error != null) {
                sink.onError(new EngineErrorEvent(wallClock.now(), "Evaluation pass aborted",
                        Deadlines.unwrap(error)));
            }
            TickReport report = new TickReport(false, pass.evaluated.get(), pass.flips.get(),
                    pass.failures.get(), pass.batches.get(), durationMs);
            sink.onSchedulerEvent(new SchedulerEvent(wallClock.now(), SchedulerEvent.Type.PASS_COMPLETED,
                    report.toString()));
            return report;
        });
    }

    public ProcessStats stats() {
        synchronized (statsLock) {
            return new ProcessStats(
                    processes.size(),
                    totalEvaluations,
                    meanEvaluationMs,
                    Set.copyOf(slowRuleIds),
                    batchCount.get(),
                    lastBatchMs,
                    preventedRaces.get(),
                    failsafe.activations());
        }
    }

    public boolean isPassRunning() {
        return runLock.availablePermits() == 0;
    }

    private List<LogicProcess> order(List<LogicProcess> snapshot) {
        List<LogicProcess> ordered = new ArrayList<>(snapshot);
        ordered.sort(Comparator
                .comparingInt((LogicProcess p) -> arbitrator.resolvedPriority(p.actuator())).reversed()
                .thenComparingLong(LogicProcess::lastEvaluationNanos));
        return ordered;
    }

    private static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return out;
    }

    private CompletableFuture<Void> runBatch(List<LogicProcess> batch, Pass pass) {
        MonotonicClock clock = deadlines.clock();
        long started = clock.nowNanos();

        List<Supplier<CompletableFuture<Void>>> tasks = new ArrayList<>(batch.size());
        for (LogicProcess process : batch) {
            tasks.add(() -> evaluateOne(process, pass));
        }

        return BoundedLauncher.runAll(tasks, policy.maxInFlight()).thenRun(() -> {
            batchCount.incrementAndGet();
            pass.batches.incrementAndGet();
            lastBatchMs = (clock.nowNanos() - started) / 1_000_000.0;
        });
    }

    private CompletableFuture<Void> evaluateOne(LogicProcess process, Pass pass) {
        long started = deadlines.clock().nowNanos();
        return deadlines.fetchWithDeadline(() -> evaluator.evaluate(process), policy.evaluationTimeout())
                .thenCompose(result -> settle(process, result, started, pass))
                .exceptionally(error -> {
                    Throwable cause = Deadlines.unwrap(error);
                    process.diagnostic(ProcessEventType.EVALUATION_ERROR, String.valueOf(cause), wallClock.now());
                    sink.onError(new EngineErrorEvent(wallClock.now(),
                            "Settling evaluation of " + process.actuator() + " failed", cause));
                    return null;
                });
    }

    private CompletableFuture<Void> settle(LogicProcess process,
                                           FetchResult<RuleVerdict> result,
                                           long startedNanos,
                                           Pass pass) {
        long finished = deadlines.clock().nowNanos();
        recordTiming(process.ruleId(), (finished - startedNanos) / 1_000_000.0);
        pass.evaluated.incrementAndGet();

        if (!processes.isCurrent(process)) {
            return CompletableFuture.completedFuture(null);
        }

        Instant now = wallClock.now();
        if (result instanceof FetchResult.Completed<RuleVerdict> completed) {
            return applyVerdict(process, completed.value(), finished, now, pass);
        }

        process.recordFailedEvaluation(finished, now);
        pass.failures.incrementAndGet();

        ProcessEventType type;
        String detail;
        if (result instanceof FetchResult.TimedOut<RuleVerdict> timedOut) {
            type = ProcessEventType.EVALUATION_TIMEOUT;
            detail = "evaluation exceeded " + timedOut.bound().toMillis() + " ms";
        } else {
            type = ProcessEventType.EVALUATION_ERROR;
            detail = String.valueOf(((FetchResult.Failed<RuleVerdict>) result).cause());
        }
        process.diagnostic(type, detail, now);
        sink.onProcessEvent(new ProcessEvent(now, type, process.actuator(), process.ruleId(), detail));

        LogicRule rule = process.rule();
        if (!rule.failsafeEnabled()) {
            return CompletableFuture.completedFuture(null);
        }
        process.markFailsafe(detail, now);
        return failsafe.activate(process.actuator(), rule.failsafeState(), rule.id(), detail)
                .handle((ignored, error) -> {
                    if (error != null) {
                        process.diagnostic(ProcessEventType.EVALUATION_ERROR,
                                "failsafe delivery failed: " + Deadlines.unwrap(error), wallClock.now());
                    }
                    return null;
                });
    }

    private CompletableFuture<Void> applyVerdict(LogicProcess process,
                                                 RuleVerdict verdict,
                                                 long finishedNanos,
                                                 Instant now,
                                                 Pass pass) {
        process.recordEvaluation(finishedNanos, now, verdict);
        if (verdict.anyFallback()) {
            process.diagnostic(ProcessEventType.DATA_QUALITY_FALLBACK, verdict.reason(), now);
            sink.onProcessEvent(new ProcessEvent(now, ProcessEventType.DATA_QUALITY_FALLBACK,
                    process.actuator(), process.ruleId(), verdict.reason()));
        }

        LogicRule rule = process.rule();
        ActuatorState desired = verdict.fire() ? rule.activeState() : ActuatorState.OFF;
        if (!process.wouldFlip(desired)) {
            return CompletableFuture.completedFuture(null);
        }

        boolean republish = process.failsafeActive();
        StateProposal proposal = new StateProposal(desired, ProposalSource.LOGIC, rule.id(), verdict.reason(), now);
        Optional<ResolvedState> submitted = processes.ifCurrent(process,
                () -> arbitrator.submit(process.actuator(), proposal));
        if (submitted.isEmpty()) {
            return CompletableFuture.completedFuture(null);
        }
        process.applyState(desired, verdict.reason(), now);
        pass.flips.incrementAndGet();

        ResolvedState resolved = submitted.get();
        if (!resolved.changed() && !republish) {
            return CompletableFuture.completedFuture(null);
        }
        return publisher.publish(resolved).handle((ignored, error) -> {
            if (error != null) {
                process.diagnostic(ProcessEventType.EVALUATION_ERROR,
                        "command delivery failed: " + Deadlines.unwrap(error), wallClock.now());
            }
            return null;
        });
    }

    private void recordTiming(String ruleId, double elapsedMs) {
        synchronized (statsLock) {
            totalEvaluations++;
            meanEvaluationMs += (elapsedMs - meanEvaluationMs) / totalEvaluations;
        }
        if (elapsedMs > policy.slowEvaluationThreshold().toMillis()) {
            if (slowRuleIds.add(ruleId)) {
                sink.onSchedulerEvent(new SchedulerEvent(wallClock.now(), SchedulerEvent.Type.SLOW_EVALUATION,
                        ruleId + " took " + elapsedMs + " ms"));
            }
        } else {
            slowRuleIds.remove(ruleId);
        }
    }

    private static final class Pass {
        private final AtomicInteger evaluated = new AtomicInteger();
        private final AtomicInteger flips = new AtomicInteger();
        private final AtomicInteger failures = new AtomicInteger();
        private final AtomicInteger batches = new AtomicInteger();
    }
}
