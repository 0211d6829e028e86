package com.questrail.edgecontrol.failsafe;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.api.ActuatorState;
import com.questrail.edgecontrol.api.ProposalSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Persisted actuator state. Stored as a JSON document.
 */
public record StateBackup(
        BackupKind kind,
        String controllerId,
        int pin,
        double level,
        ProposalSource source,
        String reason,
        Instant savedAt
) {
    public StateBackup {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(controllerId, "controllerId");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(savedAt, "savedAt");
        reason = reason == null ? "" : reason;
    }

    public static StateBackup of(BackupKind kind, ActuatorRef actuator, ActuatorState state,
                                 ProposalSource source, String reason, Instant savedAt) {
        return new StateBackup(kind, actuator.controllerId(), actuator.pin(), state.level(),
                source, reason, savedAt);
    }

    public ActuatorRef actuator() {
        return ActuatorRef.of(controllerId, pin);
    }

    public ActuatorState state() {
        return ActuatorState.level(level);
    }

    public boolean isYoungerThan(Duration ceiling, Instant now) {
        return Duration.between(savedAt, now).compareTo(ceiling) <= 0;
    }
}
