package com.questrail.edgecontrol.arbitration;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ProposalSource;
import com.questrail.edgecontrol.api.ResolvedState;
import com.questrail.edgecontrol.api.StateProposal;
import com.questrail.edgecontrol.observability.ArbitrationEvent;
import com.questrail.edgecontrol.observability.EngineObservabilitySink;
import com.questrail.edgecontrol.store.BoundedStore;
import com.questrail.edgecontrol.time.WallClock;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * ActuatorArbitrator
 * =============================================================================
 *
 * Owner of the resolved-state table.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Keeps the active proposals of every actuator, keyed by
 *       (source, origin). Resubmitting under the same key replaces the
 *       proposal in place.</li>
 *   <li>Recomputes the winner through the {@link PriorityResolver} on every
 *       change. No other path writes a resolved state.</li>
 *   <li>Bounds the table with an LRU {@link BoundedStore}.</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * All mutations run under one lock, which makes this class the serialization
 * point for the manual/alert path and the scheduler path. Priority wins,
 * arrival order does not.
 */
public final class ActuatorArbitrator {

    private final Object lock = new Object();

    private final PriorityResolver resolver;
    private final ActuatorCatalog catalog;
    private final BoundedStore<ActuatorRef, Entry> table;
    private final WallClock wallClock;
    private final EngineObservabilitySink sink;

    public ActuatorArbitrator(PriorityResolver resolver,
                              ActuatorCatalog catalog,
                              int capacity,
                              WallClock wallClock,
                              EngineObservabilitySink sink) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.table = new BoundedStore<>("resolved-states", capacity);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ResolvedState submit(ActuatorRef actuator, StateProposal proposal) {
        Objects.requireNonNull(actuator, "actuator");
        Objects.requireNonNull(proposal, "proposal");

        synchronized (lock) {
            Entry entry = table.computeIfAbsent(actuator, k -> new Entry());
            entry.active.put(new ProposalKey(proposal.source(), proposal.origin()), proposal);
            return recompute(actuator, entry);
        }
    }

    /**
     * Withdraws every proposal of {@code source} for the actuator.
     */
    public ResolvedState clear(ActuatorRef actuator, ProposalSource source) {
        synchronized (lock) {
            Entry entry = table.computeIfAbsent(actuator, k -> new Entry());
            entry.active.keySet().removeIf(key -> key.source() == source);
            return recompute(actuator, entry);
        }
    }

    /**
     * Withdraws the single proposal of {@code source} submitted by {@code origin}.
     */
    public ResolvedState clear(ActuatorRef actuator, ProposalSource source, String origin) {
        synchronized (lock) {
            Entry entry = table.computeIfAbsent(actuator, k -> new Entry());
            String normalized = origin == null || origin.isBlank() ? StateProposal.ANONYMOUS : origin;
            entry.active.remove(new ProposalKey(source, normalized));
            return recompute(actuator, entry);
        }
    }

    public Optional<StateProposal> resolved(ActuatorRef actuator) {
        synchronized (lock) {
            return table.get(actuator).map(e -> e.winner);
        }
    }

    /**
     * Priority of the current winner, or DEFAULT's priority for unknown actuators.
     */
    public int resolvedPriority(ActuatorRef actuator) {
        synchronized (lock) {
            return table.peek(actuator)
                    .map(e -> e.winner.priority())
                    .orElse(ProposalSource.DEFAULT.priority());
        }
    }

    public List<StateProposal> activeProposals(ActuatorRef actuator) {
        synchronized (lock) {
            return table.peek(actuator)
                    .map(e -> List.copyOf(e.active.values()))
                    .orElse(List.of());
        }
    }

    public int size() {
        return table.size();
    }

    private ResolvedState recompute(ActuatorRef actuator, Entry entry) {
        Instant now = wallClock.now();
        List<StateProposal> proposals = new ArrayList<>(entry.active.values());
        StateProposal winner = resolver.resolve(proposals, catalog.kindOf(actuator), now);

        StateProposal previous = entry.winner;
        boolean changed = previous == null
                || !previous.state().equals(winner.state())
                || previous.source() != winner.source();
        entry.winner = winner;

        ResolvedState resolved = new ResolvedState(actuator, winner, proposals.size(), changed, now);
        sink.onArbitration(new ArbitrationEvent(now, actuator, winner, proposals.size(), changed));
        return resolved;
    }

    private record ProposalKey(ProposalSource source, String origin) {}

    private static final class Entry {
        private final Map<ProposalKey, StateProposal> active = new LinkedHashMap<>();
        private StateProposal winner;
    }
}
