package com.questrail.edgecontrol.scheduling;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs asynchronous tasks with at most {@code maxInFlight} outstanding at a
 * time. Tasks start in list order. The returned future completes once every
 * task has completed, however it completed.
 */
final class BoundedLauncher {

    private BoundedLauncher() {
    }

    static CompletableFuture<Void> runAll(List<Supplier<CompletableFuture<Void>>> tasks, int maxInFlight) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        if (tasks.isEmpty()) {
            done.complete(null);
            return done;
        }

        AtomicInteger next = new AtomicInteger();
        AtomicInteger remaining = new AtomicInteger(tasks.size());
        int initial = Math.min(maxInFlight, tasks.size());
        for (int i = 0; i < initial; i++) {
            launchNext(tasks, next, remaining, done);
        }
        return done;
    }

    private static void launchNext(List<Supplier<CompletableFuture<Void>>> tasks,
                                   AtomicInteger next,
                                   AtomicInteger remaining,
                                   CompletableFuture<Void> done) {
        int index = next.getAndIncrement();
        if (index >= tasks.size()) {
            return;
        }

        CompletableFuture<Void> running;
        try {
            running = tasks.get(index).get();
        } catch (RuntimeException e) {
            running = CompletableFuture.failedFuture(e);
        }

        running.whenComplete((ignored, error) -> {
            if (remaining.decrementAndGet() == 0) {
                done.complete(null);
            } else {
                launchNext(tasks, next, remaining, done);
            }
        });
    }
}
