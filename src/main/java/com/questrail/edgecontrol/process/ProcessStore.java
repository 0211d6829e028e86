package com.questrail.edgecontrol.process;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.CapacityExceededException;
import com.questrail.edgecontrol.api.RuleUnavailableException;
import com.questrail.edgecontrol.config.StoreLimits;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.observability.ProcessEvent;
import com.questrail.edgecontrol.observability.ProcessEventType;
import com.questrail.edgecontrol.rule.LogicRule;
import com.questrail.edgecontrol.time.WallClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * ProcessStore
 * =============================================================================
 *
 * Running logic processes, at most one per actuator.
 *
 * <h2>Start</h2>
 * <ul>
 *   <li>a missing or disabled rule is rejected with {@link RuleUnavailableException}</li>
 *   <li>starting a rule for an actuator that already has a process replaces it;
 *       the replaced process is stopped</li>
 *   <li>a new actuator beyond {@link StoreLimits#maxRunningProcesses()} is
 *       rejected with {@link CapacityExceededException}</li>
 * </ul>
 *
 * <h2>Stop</h2>
 * Idempotent. A process stopped while its evaluation is in flight is no longer
 * {@link #isCurrent(LogicProcess) current}, so the late result is discarded.
 * The stop listener runs for every process that leaves the store, whether
 * stopped or replaced, after it was removed and outside the store lock.
 */
public final class ProcessStore {

    private final Object lock = new Object();
    private final Map<ActuatorRef, LogicProcess> processes = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    private final StoreLimits limits;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;
    private final Consumer<LogicProcess> stopListener;

    public ProcessStore(StoreLimits limits, WallClock wallClock, EngineObservabilitySink sink) {
        this(limits, wallClock, sink, p -> { });
    }

    public ProcessStore(StoreLimits limits,
                        WallClock wallClock,
                        EngineObservabilitySink sink,
                        Consumer<LogicProcess> stopListener) {
        this.limits = Objects.requireNonNull(limits, "limits");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.stopListener = Objects.requireNonNull(stopListener, "stopListener");
    }

    public LogicProcess start(LogicRule rule) {
        if (rule == null) {
            throw new RuleUnavailableException("Rule not found");
        }
        if (!rule.enabled()) {
            throw new RuleUnavailableException("Rule " + rule.id() + " is disabled");
        }

        Instant now = wallClock.now();
        LogicProcess replaced;
        LogicProcess started;
        synchronized (lock) {
            replaced = processes.get(rule.actuator());
            if (replaced == null && processes.size() >= limits.maxRunningProcesses()) {
                throw new CapacityExceededException(limits.maxRunningProcesses());
            }
            String processId = "process-" + rule.id() + "-" + sequence.incrementAndGet();
            started = new LogicProcess(processId, rule, now,
                    limits.triggerHistory(), limits.diagnosticLog());
            processes.put(rule.actuator(), started);
        }

        if (replaced != null) {
            stopped(replaced, "replaced by " + started.processId(), now);
        }
        started.diagnostic(ProcessEventType.PROCESS_STARTED, started.processId(), now);
        sink.onProcessEvent(new ProcessEvent(now, ProcessEventType.PROCESS_STARTED,
                rule.actuator(), rule.id(), started.processId()));
        return started;
    }

    public Optional<LogicProcess> stop(ActuatorRef actuator) {
        LogicProcess removed;
        synchronized (lock) {
            removed = processes.remove(actuator);
        }
        if (removed == null) {
            return Optional.empty();
        }
        stopped(removed, "stopped", wallClock.now());
        return Optional.of(removed);
    }

    public Optional<LogicProcess> get(ActuatorRef actuator) {
        synchronized (lock) {
            return Optional.ofNullable(processes.get(actuator));
        }
    }

    public List<LogicProcess> byRule(String ruleId) {
        List<LogicProcess> out = new ArrayList<>();
        for (LogicProcess p : running()) {
            if (p.ruleId().equals(ruleId)) {
                out.add(p);
            }
        }
        return out;
    }

    /**
     * Snapshot of all running processes in start order.
     */
    public List<LogicProcess> running() {
        synchronized (lock) {
            return new ArrayList<>(processes.values());
        }
    }

    public boolean isCurrent(LogicProcess process) {
        synchronized (lock) {
            return processes.get(process.actuator()) == process;
        }
    }

    /**
     * Runs {@code action} only while {@code process} is still the current
     * process of its actuator. The store lock is held for the duration, so a
     * concurrent stop either happens before (and the action is skipped) or
     * after (and sees whatever the action did).
     */
    public <T> Optional<T> ifCurrent(LogicProcess process, Supplier<T> action) {
        synchronized (lock) {
            if (processes.get(process.actuator()) != process) {
                return Optional.empty();
            }
            return Optional.of(action.get());
        }
    }

    public int size() {
        synchronized (lock) {
            return processes.size();
        }
    }

    private void stopped(LogicProcess process, String detail, Instant now) {
        process.markStopped();
        process.diagnostic(ProcessEventType.PROCESS_STOPPED, detail, now);
        sink.onProcessEvent(new ProcessEvent(now, ProcessEventType.PROCESS_STOPPED,
                process.actuator(), process.ruleId(), detail));
        stopListener.accept(process);
    }
}
