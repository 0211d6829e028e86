package com.questrail.edgecontrol.scheduling;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class BoundedLauncherTest {

    @Test
    void emptyTaskListCompletesImmediately() {
        assertTrue(BoundedLauncher.runAll(List.of(), 3).isDone());
    }

    @Test
    void neverMoreThanMaxInFlightOutstanding() {
        List<CompletableFuture<Void>> gates = new ArrayList<>();
        List<Supplier<CompletableFuture<Void>>> tasks = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            CompletableFuture<Void> gate = new CompletableFuture<>();
            gates.add(gate);
            tasks.add(() -> gate);
        }
        List<Integer> started = new ArrayList<>();
        List<Supplier<CompletableFuture<Void>>> tracked = new ArrayList<>();
        for (int i = 0; i < tasks.size(); i++) {
            int index = i;
            tracked.add(() -> {
                started.add(index);
                return tasks.get(index).get();
            });
        }

        CompletableFuture<Void> all = BoundedLauncher.runAll(tracked, 2);
        assertEquals(List.of(0, 1), started);

        gates.get(1).complete(null);
        assertEquals(List.of(0, 1, 2), started);

        gates.get(0).completeExceptionally(new IllegalStateException("failed evaluation"));
        assertEquals(List.of(0, 1, 2, 3), started);

        gates.get(2).complete(null);
        gates.get(3).complete(null);
        assertFalse(all.isDone());

        gates.get(4).complete(null);
        assertTrue(all.isDone());
        assertFalse(all.isCompletedExceptionally(), "failures are the task's business");
    }

    @Test
    void throwingTaskDoesNotStallTheRest() {
        List<Supplier<CompletableFuture<Void>>> tasks = List.of(
                () -> { throw new IllegalStateException("boom"); },
                () -> CompletableFuture.completedFuture(null));

        assertTrue(BoundedLauncher.runAll(tasks, 1).isDone());
    }
}
