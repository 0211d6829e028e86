package com.questrail.edgecontrol.failsafe;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.StateProposal;
import com.questrail.edgecontrol.config.BackupPolicy;
import com.questrail.edgecontrol.observability.EngineErrorEvent;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.observability.ProcessEvent;
import com.questrail.edgecontrol.observability.ProcessEventType;
import com.questrail.edgecontrol.time.WallClock;
import com.questrail.edgecontrol.transport.CommandDispatcher;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * FailsafeCoordinator
 * =============================================================================
 *
 * Forces actuators into a safe state when evaluation cannot be trusted, and
 * brings them back from persisted backups on recovery.
 *
 * <h2>Activation</h2>
 * <ol>
 *   <li>a safety backup is persisted, even if delivery later fails</li>
 *   <li>the safe state is published directly; the resolved-state table is not
 *       touched, so arbitration resumes unchanged on the next flip</li>
 *   <li>a delivery failure is reported and surfaced on the returned future;
 *       it is never retried here</li>
 * </ol>
 *
 * <h2>Restore</h2>
 * A live safety backup wins over a live state backup and is consumed when
 * applied. A backup older than its {@link BackupPolicy} ceiling is removed
 * without being applied.
 */
public final class FailsafeCoordinator {

    private final CommandDispatcher dispatcher;
    private final KeyValueStore store;
    private final BackupPolicy policy;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;

    private final AtomicLong activations = new AtomicLong();

    public FailsafeCoordinator(CommandDispatcher dispatcher,
                               KeyValueStore store,
                               BackupPolicy policy,
                               WallClock wallClock,
                               EngineObservabilitySink sink) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.store = Objects.requireNonNull(store, "store");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public CompletableFuture<Void> activate(ActuatorRef actuator, ActuatorState safeState) {
        return activate(actuator, safeState, StateProposal.ANONYMOUS, "failsafe");
    }

    /**
     * @param origin rule id (or other producer) on whose behalf failsafe is applied
     * @param reason why evaluation could not be trusted
     */
    public CompletableFuture<Void> activate(ActuatorRef actuator, ActuatorState safeState,
                                            String origin, String reason) {
        Objects.requireNonNull(actuator, "actuator");
        Objects.requireNonNull(safeState, "safeState");

        Instant now = wallClock.now();
        activations.incrementAndGet();

        String detail = "failsafe " + safeState + ": " + reason;
        StateProposal forced = new StateProposal(safeState, ProposalSource.LOGIC, origin, detail, now);
        store.save(BackupKind.SAFETY.keyFor(actuator), BackupCodec.encode(
                StateBackup.of(BackupKind.SAFETY, actuator, safeState, ProposalSource.LOGIC, detail, now)));

        sink.onProcessEvent(new ProcessEvent(now, ProcessEventType.FAILSAFE_ACTIVATED, actuator, origin, detail));
        return dispatcher.publish(actuator, forced);
    }

    /**
     * Persists the authoritative state that was just published.
     */
    public void persistState(ActuatorRef actuator, StateProposal published) {
        StateBackup backup = StateBackup.of(BackupKind.STATE, actuator, published.state(),
                published.source(), published.reason(), wallClock.now());
        store.save(BackupKind.STATE.keyFor(actuator), BackupCodec.encode(backup));
    }

    /**
     * Applies the freshest eligible backup of the actuator.
     *
     * @return the applied backup, empty if none was eligible
     */
    public CompletableFuture<Optional<StateBackup>> restore(ActuatorRef actuator) {
        Instant now = wallClock.now();

        Optional<StateBackup> safety = live(BackupKind.SAFETY, actuator, now);
        if (safety.isPresent()) {
            store.remove(BackupKind.SAFETY.keyFor(actuator));
            return apply(actuator, safety.get());
        }

        Optional<StateBackup> state = live(BackupKind.STATE, actuator, now);
        if (state.isPresent()) {
            return apply(actuator, state.get());
        }
        return CompletableFuture.completedFuture(Optional.empty());
    }

    public Optional<StateBackup> backup(BackupKind kind, ActuatorRef actuator) {
        String json = store.load(kind.keyFor(actuator), null);
        return json == null ? Optional.empty() : Optional.of(BackupCodec.decode(json));
    }

    public long activations() {
        return activations.get();
    }

    private Optional<StateBackup> live(BackupKind kind, ActuatorRef actuator, Instant now) {
        String key = kind.keyFor(actuator);
        String json = store.load(key, null);
        if (json == null) {
            return Optional.empty();
        }

        StateBackup backup;
        try {
            backup = BackupCodec.decode(json);
        } catch (IllegalArgumentException e) {
            sink.onError(new EngineErrorEvent(now, "Discarding unreadable " + kind + " backup of " + actuator, e));
            store.remove(key);
            return Optional.empty();
        }

        if (!backup.isYoungerThan(kind.maxAge(policy), now)) {
            store.remove(key);
            return Optional.empty();
        }
        return Optional.of(backup);
    }

    private CompletableFuture<Optional<StateBackup>> apply(ActuatorRef actuator, StateBackup backup) {
        StateProposal restored = new StateProposal(backup.state(), backup.source(), StateProposal.ANONYMOUS,
                "restored " + backup.kind() + " backup", wallClock.now());
        return dispatcher.publish(actuator, restored).thenApply(ignored -> Optional.of(backup));
    }
}
