package com.questrail.edgecontrol.process;

/**
 * Lifecycle of a logic process. The only transitions are
 * {@code STOPPED -> RUNNING -> STOPPED}; a stopped process is never restarted,
 * a new one is created instead.
 */
public enum ProcessStatus {
    RUNNING,
    STOPPED
}
