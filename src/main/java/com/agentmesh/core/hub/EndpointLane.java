package com.agentmesh.core.hub;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Serial delivery lane for one endpoint: tasks run one at a time in submission order.
 * A handle cancelled before its task starts is skipped.
 */
class EndpointLane {

    private final Executor executor;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    EndpointLane(Executor executor) {
        this.executor = executor;
    }

    synchronized <T> CompletableFuture<T> submit(Supplier<T> task) {
        var handle = new CompletableFuture<T>();
        tail = tail.exceptionally(e -> null).thenRunAsync(() -> {
            if (handle.isDone()) {
                return;
            }
            try {
                handle.complete(task.get());
            } catch (RuntimeException e) {
                handle.completeExceptionally(e);
            }
        }, executor);
        return handle;
    }
}
