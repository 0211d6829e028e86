package com.questrail.edgecontrol.evaluation;

import com.questrail.edgecontrol.rule.LogicEvent;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Last time each named event was signalled. An event is satisfied while its
 * last signal is no older than the event's max age.
 */
public final class EventLedger {

    private final ConcurrentMap<String, Instant> lastSignalled = new ConcurrentHashMap<>();

    public void signal(String name, Instant at) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(at, "at");
        lastSignalled.merge(name, at, (old, fresh) -> fresh.isAfter(old) ? fresh : old);
    }

    public Optional<Instant> lastSignal(String name) {
        return Optional.ofNullable(lastSignalled.get(name));
    }

    public boolean isSatisfied(LogicEvent event, Instant now) {
        Instant last = lastSignalled.get(event.name());
        if (last == null) {
            return false;
        }
        return Duration.between(last, now).compareTo(event.maxAge()) <= 0;
    }
}
