package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;
import com.ryuqq.viewstore.core.update.Update;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Root-store primitives a transaction executes against.
 *
 * <p>The {@code apply*} methods mutate storage and advance the version but publish nothing;
 * publishing is left to the caller so that a whole transaction surfaces as one event.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public interface MutationTarget<T> {

    CompletableFuture<ItemAdded<T>> applyAdd(T item);

    CompletableFuture<ItemUpdated<T>> applyPut(T item);

    CompletableFuture<ItemUpdated<T>> applyPatch(String id, Patch patch);

    CompletableFuture<ItemDeleted<T>> applyDelete(String id);

    boolean isUpdate(T item);

    void publish(List<Update<T>> updates);

    /**
     * Runs a task once every previously sequenced task has settled.
     *
     * @param task mutation task
     * @param <R> result type
     * @return the task's result
     */
    <R> CompletableFuture<R> sequence(Supplier<? extends CompletableFuture<R>> task);
}
