package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.update.BatchUpdate;

import java.util.concurrent.CompletableFuture;

/**
 * Buffered group of heterogeneous mutations committed as one batch.
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>Requests run sequentially, in buffer order</li>
 *   <li>No other mutation of the same root runs in between</li>
 *   <li>Subscribers see exactly one {@link BatchUpdate}</li>
 * </ul>
 *
 * <p><strong>Not atomic:</strong> the first failing request stops the commit, which fails with
 * {@link com.ryuqq.viewstore.core.error.TransactionFailedException}. Requests applied before it
 * stay applied and are still published as one batch.</p>
 *
 * <pre>
 * store.transaction()
 *     .add(newTask)
 *     .patch("t-7", Patch.builder().replace("status", "DONE").build())
 *     .delete("t-3")
 *     .commit()
 *     .join();
 * </pre>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public interface Transaction<T> {

    Transaction<T> add(T item);

    /**
     * Buffers a put. Whether it updates or adds is decided when it executes.
     *
     * @param item the item
     * @return this transaction
     */
    Transaction<T> put(T item);

    /**
     * Buffers one patch request per id of the set.
     *
     * @param patchSet patches by id
     * @return this transaction
     */
    Transaction<T> patch(PatchSet patchSet);

    Transaction<T> patch(String id, Patch patch);

    Transaction<T> delete(String... ids);

    /**
     * Executes the buffered requests.
     *
     * @return the published batch
     * @throws IllegalStateException if already committed
     */
    CompletableFuture<BatchUpdate<T>> commit();

    int size();

    boolean isCommitted();
}
