package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.util.Futures;

import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * FIFO queue of asynchronous mutation tasks.
 *
 * <p>A task starts only after the previous one has settled, successfully or not, so the
 * effects of two calls never interleave. A second transaction therefore waits instead of
 * being rejected. The tail is claimed before the task runs, which keeps tasks submitted
 * from inside a running task (e.g. by a subscriber) behind it.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class MutationSequencer {

    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    /**
     * Queues a task behind every task submitted before it.
     *
     * @param task starts the work and returns its future
     * @param <R> result type
     * @return future completing with the task's outcome
     * @throws IllegalArgumentException if task is null
     */
    public <R> CompletableFuture<R> submit(Supplier<? extends CompletableFuture<R>> task) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        CompletableFuture<R> result = new CompletableFuture<>();
        CompletableFuture<Void> previous;
        synchronized (this) {
            previous = tail;
            // the next task waits for this one whatever its outcome; callers see the outcome on result
            tail = result.handle((value, error) -> null);
        }
        previous.whenComplete((ignored, priorError) -> run(task, result));
        return result;
    }

    /**
     * Whether no task is queued or running.
     *
     * @return idle flag
     */
    synchronized boolean isIdle() {
        return tail.isDone();
    }

    private static <R> void run(Supplier<? extends CompletableFuture<R>> task, CompletableFuture<R> result) {
        CompletableFuture<R> stage;
        try {
            stage = task.get();
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
            return;
        }
        stage.whenComplete((value, error) -> {
            if (error != null) {
                result.completeExceptionally(Futures.unwrap(error));
            } else {
                result.complete(value);
            }
        });
    }
}
