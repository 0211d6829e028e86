package com.questrail.edgecontrol.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * BoundedStore
 * -----------------------------------------------------------------------------
 * A fixed-capacity map that evicts the least-recently-touched entry when an
 * insertion would exceed its capacity.
 *
 * <h2>Touch semantics</h2>
 * {@link #get}, {@link #put} and {@link #computeIfAbsent} count as touches and
 * move the entry to the most-recent end. {@link #peek}, {@link #values} and
 * {@link #keys} do not.
 *
 * <h2>Ownership</h2>
 * Stores are plain instances owned by the component that created them. There
 * is no global registry, so several engines may coexist in one JVM (and in one
 * test).
 *
 * <h2>Threading</h2>
 * All operations synchronize on the store. The eviction listener runs while
 * that monitor is held and must not call back into the store.
 *
 * <h2>Index</h2>
 * An unordered map mirrors the entries so {@link #peek} is a constant-time
 * lookup that leaves the access order alone.
 */
public final class BoundedStore<K, V> {

    private final String name;
    private final int capacity;
    private final BiConsumer<K, V> evictionListener;
    private final LinkedHashMap<K, V> entries;
    private final Map<K, V> index = new HashMap<>();

    public BoundedStore(String name, int capacity) {
        this(name, capacity, (k, v) -> { });
    }

    public BoundedStore(String name, int capacity, BiConsumer<K, V> evictionListener) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be > 0");
        }
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = capacity;
        this.evictionListener = Objects.requireNonNull(evictionListener, "evictionListener");
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                if (size() > BoundedStore.this.capacity) {
                    index.remove(eldest.getKey());
                    BoundedStore.this.evictionListener.accept(eldest.getKey(), eldest.getValue());
                    return true;
                }
                return false;
            }
        };
    }

    public synchronized Optional<V> get(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * Reads without refreshing the entry's recency.
     */
    public synchronized Optional<V> peek(K key) {
        return Optional.ofNullable(index.get(key));
    }

    public synchronized void put(K key, V value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        index.put(key, value);
        entries.put(key, value);
    }

    public synchronized V computeIfAbsent(K key, Function<K, V> factory) {
        V value = entries.computeIfAbsent(Objects.requireNonNull(key, "key"), factory);
        if (value != null) {
            index.put(key, value);
        }
        return value;
    }

    public synchronized Optional<V> remove(K key) {
        index.remove(key);
        return Optional.ofNullable(entries.remove(key));
    }

    /**
     * Removes {@code key} only while it is still mapped to {@code expected}.
     */
    public synchronized boolean remove(K key, V expected) {
        if (!entries.remove(key, expected)) {
            return false;
        }
        index.remove(key);
        return true;
    }

    public synchronized boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Snapshot of the values, least-recently-touched first.
     */
    public synchronized List<V> values() {
        return new ArrayList<>(entries.values());
    }

    public synchronized List<K> keys() {
        return new ArrayList<>(entries.keySet());
    }

    public synchronized void clear() {
        entries.clear();
        index.clear();
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    @Override
    public String toString() {
        return "BoundedStore[" + name + ", " + size() + "/" + capacity + "]";
    }
}
