package com.questrail.edgecontrol.process;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.evaluation.ConditionOutcome;
import com.questrail.edgecontrol.evaluation.RuleVerdict;
import com.questrail.edgecontrol.observability.ProcessEventType;
import com.questrail.edgecontrol.rule.LogicRule;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * LogicProcess
 * -----------------------------------------------------------------------------
 * Runtime instance of one {@link LogicRule} while it is scheduled for
 * evaluation.
 *
 * <h2>Bookkeeping</h2>
 * <ul>
 *   <li>evaluation count and monotonic time of the last evaluation, used to
 *       schedule the oldest-evaluated process first</li>
 *   <li>the state the process last computed for its actuator</li>
 *   <li>the last result obtained from usable data, per condition</li>
 *   <li>bounded trigger history and diagnostic log, oldest dropped first</li>
 * </ul>
 *
 * <p>All accessors are synchronized; a process is read by the scheduler and by
 * query callers concurrently.</p>
 */
public final class LogicProcess {

    /** Sort key of a process that has never been evaluated. */
    public static final long NEVER_EVALUATED = Long.MIN_VALUE;

    private final String processId;
    private final LogicRule rule;
    private final Instant startedAt;
    private final int triggerCapacity;
    private final int diagnosticCapacity;

    private ProcessStatus status = ProcessStatus.RUNNING;
    private long lastEvaluationNanos = NEVER_EVALUATED;
    private Instant lastEvaluatedAt;
    private long evaluationCount;
    private ActuatorState currentState;
    private boolean failsafeActive;
    private final Boolean[] lastValid;
    private final Deque<TriggerRecord> triggers = new ArrayDeque<>();
    private final Deque<DiagnosticRecord> diagnostics = new ArrayDeque<>();

    LogicProcess(String processId, LogicRule rule, Instant startedAt, int triggerCapacity, int diagnosticCapacity) {
        this.processId = Objects.requireNonNull(processId, "processId");
        this.rule = Objects.requireNonNull(rule, "rule");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.triggerCapacity = triggerCapacity;
        this.diagnosticCapacity = diagnosticCapacity;
        this.lastValid = new Boolean[rule.conditions().size()];
    }

    public String processId() {
        return processId;
    }

    public LogicRule rule() {
        return rule;
    }

    public ActuatorRef actuator() {
        return rule.actuator();
    }

    public String ruleId() {
        return rule.id();
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized ProcessStatus status() {
        return status;
    }

    public synchronized long lastEvaluationNanos() {
        return lastEvaluationNanos;
    }

    public synchronized Optional<Instant> lastEvaluatedAt() {
        return Optional.ofNullable(lastEvaluatedAt);
    }

    public synchronized long evaluationCount() {
        return evaluationCount;
    }

    public synchronized Optional<ActuatorState> currentState() {
        return Optional.ofNullable(currentState);
    }

    public synchronized List<Optional<Boolean>> lastValidResults() {
        List<Optional<Boolean>> out = new ArrayList<>(lastValid.length);
        for (Boolean b : lastValid) {
            out.add(Optional.ofNullable(b));
        }
        return out;
    }

    public synchronized List<TriggerRecord> triggerHistory() {
        return List.copyOf(triggers);
    }

    public synchronized List<DiagnosticRecord> diagnostics() {
        return List.copyOf(diagnostics);
    }

    /**
     * Records a completed evaluation and remembers every condition result that
     * came from usable data.
     */
    public synchronized void recordEvaluation(long monotonicNanos, Instant at, RuleVerdict verdict) {
        evaluationCount++;
        lastEvaluationNanos = monotonicNanos;
        lastEvaluatedAt = at;
        List<ConditionOutcome> outcomes = verdict.outcomes();
        for (int i = 0; i < outcomes.size() && i < lastValid.length; i++) {
            if (!outcomes.get(i).fellBack()) {
                lastValid[i] = outcomes.get(i).result();
            }
        }
    }

    /**
     * Counts an evaluation that ended in error or timeout.
     */
    public synchronized void recordFailedEvaluation(long monotonicNanos, Instant at) {
        evaluationCount++;
        lastEvaluationNanos = monotonicNanos;
        lastEvaluatedAt = at;
    }

    /**
     * Returns whether {@code desired} differs from the state this process last computed.
     */
    public synchronized boolean wouldFlip(ActuatorState desired) {
        return !desired.equals(currentState);
    }

    /**
     * True between a failsafe activation and the next computed state. The
     * actuator's output then differs from the resolved table, so the next
     * state must be published even if arbitration reports no change.
     */
    public synchronized boolean failsafeActive() {
        return failsafeActive;
    }

    /**
     * Forgets the computed state after failsafe forced the actuator, so the
     * next successful evaluation is treated as a flip.
     */
    public synchronized void markFailsafe(String detail, Instant at) {
        currentState = null;
        failsafeActive = true;
        append(diagnostics, new DiagnosticRecord(at, ProcessEventType.FAILSAFE_ACTIVATED, detail), diagnosticCapacity);
    }

    public synchronized void applyState(ActuatorState state, String reason, Instant at) {
        currentState = state;
        failsafeActive = false;
        TriggerRecord.Transition transition = state.isOn()
                ? TriggerRecord.Transition.ACTIVATED
                : TriggerRecord.Transition.DEACTIVATED;
        append(triggers, new TriggerRecord(at, transition, state, reason), triggerCapacity);
    }

    public synchronized void diagnostic(ProcessEventType type, String detail, Instant at) {
        append(diagnostics, new DiagnosticRecord(at, type, detail), diagnosticCapacity);
    }

    synchronized void markStopped() {
        status = ProcessStatus.STOPPED;
    }

    private static <T> void append(Deque<T> log, T entry, int capacity) {
        log.addLast(entry);
        while (log.size() > capacity) {
            log.removeFirst();
        }
    }

    @Override
    public String toString() {
        return "LogicProcess[" + processId + ", " + rule.actuator() + ", " + status() + "]";
    }
}
