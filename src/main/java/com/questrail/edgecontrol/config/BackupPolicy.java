package com.questrail.edgecontrol.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Maximum age at which a persisted backup may still be applied on recovery.
 * Older backups are discarded unapplied.
 */
public record BackupPolicy(Duration stateBackupMaxAge, Duration safetyBackupMaxAge) {

    public BackupPolicy {
        Objects.requireNonNull(stateBackupMaxAge, "stateBackupMaxAge");
        Objects.requireNonNull(safetyBackupMaxAge, "safetyBackupMaxAge");
    }

    /**
     * State backups 24 hours, safety backups 1 hour.
     */
    public static BackupPolicy defaults() {
        return new BackupPolicy(Duration.ofHours(24), Duration.ofHours(1));
    }
}
