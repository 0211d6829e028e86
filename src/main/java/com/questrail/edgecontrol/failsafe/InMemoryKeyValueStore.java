package com.questrail.edgecontrol.failsafe;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Volatile store for tests and hosts without persistence. Backups do not
 * survive a restart.
 */
public final class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentMap<String, String> values = new ConcurrentHashMap<>();

    @Override
    public void save(String key, String value) {
        values.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public String load(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    @Override
    public void remove(String key) {
        values.remove(key);
    }

    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }
}
