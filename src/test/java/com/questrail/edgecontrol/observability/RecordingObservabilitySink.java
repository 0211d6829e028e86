package com.questrail.edgecontrol.observability;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingObservabilitySink implements EngineObservabilitySink {
    private final List<Object> events = new ArrayList<>();

    @Override
    public synchronized void onArbitration(ArbitrationEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onProcessEvent(ProcessEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onSchedulerEvent(SchedulerEvent event) {
        events.add(event);
    }

    @Override
    public synchronized void onError(EngineErrorEvent event) {
        events.add(event);
    }

    public synchronized List<Object> getAllEvents() {
        return new ArrayList<>(events);
    }

    public synchronized List<ProcessEvent> getProcessEvents(ProcessEventType type) {
        return events.stream()
            .filter(e -> e instanceof ProcessEvent)
            .map(e -> (ProcessEvent) e)
            .filter(e -> e.type() == type)
            .collect(Collectors.toList());
    }

    public synchronized List<SchedulerEvent> getSchedulerEvents(SchedulerEvent.Type type) {
        return events.stream()
            .filter(e -> e instanceof SchedulerEvent)
            .map(e -> (SchedulerEvent) e)
            .filter(e -> e.type() == type)
            .collect(Collectors.toList());
    }

    public synchronized <T> boolean hasEventOfType(Class<T> type) {
        return events.stream().anyMatch(type::isInstance);
    }
}
