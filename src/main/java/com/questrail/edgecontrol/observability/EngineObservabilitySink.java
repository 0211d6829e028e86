package com.questrail.edgecontrol.observability;

/**
 * Main interface for receiving engine observability events.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks run on engine threads and must not block.</p>
 */
public interface EngineObservabilitySink {
    /**
     * Called after every arbitration of an actuator, whether or not the winner changed.
     * @param event the arbitration outcome
     */
    void onArbitration(ArbitrationEvent event);

    /**
     * Called on logic process lifecycle and diagnostic events (start, stop, timeout, failsafe...).
     * @param event the process event
     */
    void onProcessEvent(ProcessEvent event);

    /**
     * Called when an evaluation pass completes or is skipped.
     * @param event the scheduler event
     */
    void onSchedulerEvent(SchedulerEvent event);

    /**
     * Called when an error or anomaly occurs in the engine.
     * @param event the error event
     */
    void onError(EngineErrorEvent event);
}
