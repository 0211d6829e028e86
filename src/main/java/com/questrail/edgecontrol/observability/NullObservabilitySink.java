package com.questrail.edgecontrol.observability;

/**
 * No-op implementation of EngineObservabilitySink.
 */
public final class NullObservabilitySink implements EngineObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onArbitration(ArbitrationEvent event) {}

    @Override
    public void onProcessEvent(ProcessEvent event) {}

    @Override
    public void onSchedulerEvent(SchedulerEvent event) {}

    @Override
    public void onError(EngineErrorEvent event) {}
}
