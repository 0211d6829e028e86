package com.questrail.edgecontrol.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedStoreTest {

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedStore<String, String>("s", 0));
    }

    @Test
    void evictsLeastRecentlyTouchedEntry() {
        List<String> evicted = new ArrayList<>();
        BoundedStore<String, Integer> store = new BoundedStore<>("s", 2, (k, v) -> evicted.add(k));

        store.put("a", 1);
        store.put("b", 2);
        store.get("a");
        store.put("c", 3);

        assertEquals(List.of("b"), evicted);
        assertTrue(store.containsKey("a"));
        assertTrue(store.containsKey("c"));
        assertEquals(2, store.size());
    }

    @Test
    void peekDoesNotRefreshRecency() {
        BoundedStore<String, Integer> store = new BoundedStore<>("s", 2);

        store.put("a", 1);
        store.put("b", 2);
        assertEquals(1, store.peek("a").orElseThrow());
        store.put("c", 3);

        assertFalse(store.containsKey("a"));
        assertTrue(store.peek("b").isPresent());
    }

    @Test
    void conditionalRemoveOnlyRemovesMatchingValue() {
        BoundedStore<String, String> store = new BoundedStore<>("s", 4);
        store.put("k", "v1");

        assertFalse(store.remove("k", "other"));
        assertTrue(store.remove("k", "v1"));
        assertTrue(store.isEmpty());
    }

    @Test
    void computeIfAbsentKeepsExistingValue() {
        BoundedStore<String, String> store = new BoundedStore<>("s", 4);
        store.put("k", "first");

        assertEquals("first", store.computeIfAbsent("k", key -> "second"));
        assertEquals("fresh", store.computeIfAbsent("n", key -> "fresh"));
        assertEquals(List.of("k", "n"), store.keys());
    }

    @Test
    void peekTracksEvictionRemovalAndComputedEntries() {
        BoundedStore<String, Integer> store = new BoundedStore<>("s", 2);

        store.computeIfAbsent("a", key -> 1);
        store.put("b", 2);
        store.put("c", 3);
        assertTrue(store.peek("a").isEmpty());
        assertEquals(3, store.peek("c").orElseThrow());

        store.remove("b");
        assertTrue(store.peek("b").isEmpty());
        store.put("c", 30);
        assertEquals(30, store.peek("c").orElseThrow());

        store.clear();
        assertTrue(store.peek("c").isEmpty());
    }
}
