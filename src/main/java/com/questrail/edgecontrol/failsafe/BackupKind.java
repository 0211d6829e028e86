package com.questrail.edgecontrol.failsafe;

import com.questrail.edgecontrol.api.ActuatorRef;
import com.questrail.edgecontrol.config.BackupPolicy;

import java.time.Duration;

/**
 * Class of a persisted backup. Each class has its own age ceiling.
 */
public enum BackupKind {
    /** Last published authoritative state. */
    STATE("state"),
    /** State forced by a failsafe activation. Consumed when restored. */
    SAFETY("safety");

    private final String prefix;

    BackupKind(String prefix) {
        this.prefix = prefix;
    }

    public String keyFor(ActuatorRef actuator) {
        return "backup:" + prefix + ":" + actuator.key();
    }

    public Duration maxAge(BackupPolicy policy) {
        return this == STATE ? policy.stateBackupMaxAge() : policy.safetyBackupMaxAge();
    }
}
