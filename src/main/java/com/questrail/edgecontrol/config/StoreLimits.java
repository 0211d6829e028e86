package com.questrail.edgecontrol.config;

/**
 * Capacities of the engine's bounded stores.
 */
public record StoreLimits(
        int maxRunningProcesses,
        int resolvedStates,
        int sampleCache,
        int triggerHistory,
        int diagnosticLog,
        int crossControllerRules
) {
    public StoreLimits {
        if (maxRunningProcesses <= 0 || resolvedStates <= 0 || sampleCache <= 0
                || triggerHistory <= 0 || diagnosticLog <= 0 || crossControllerRules <= 0) {
            throw new IllegalArgumentException("all store limits must be > 0");
        }
    }

    public static StoreLimits defaults() {
        return new StoreLimits(10, 1000, 1000, 50, 200, 50);
    }

    public StoreLimits withMaxRunningProcesses(int value) {
        return new StoreLimits(value, resolvedStates, sampleCache, triggerHistory, diagnosticLog,
                crossControllerRules);
    }
}
