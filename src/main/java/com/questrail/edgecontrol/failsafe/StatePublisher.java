package com.questrail.edgecontrol.failsafe;

import com.questrail.edgecontrol.api.ResolvedState;
import com.questrail.edgecontrol.transport.CommandDispatcher;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Forwards a resolved state outward and, once the transport accepted it,
 * records it as the actuator's state backup.
 */
public final class StatePublisher {

    private final CommandDispatcher dispatcher;
    private final FailsafeCoordinator failsafe;

    public StatePublisher(CommandDispatcher dispatcher, FailsafeCoordinator failsafe) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.failsafe = Objects.requireNonNull(failsafe, "failsafe");
    }

    public CompletableFuture<Void> publish(ResolvedState resolved) {
        return dispatcher.publish(resolved.actuator(), resolved.winner())
                .thenRun(() -> failsafe.persistState(resolved.actuator(), resolved.winner()));
    }
}
