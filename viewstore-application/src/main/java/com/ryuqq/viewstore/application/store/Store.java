package com.ryuqq.viewstore.application.store;

import com.ryuqq.viewstore.application.transaction.Transaction;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.query.Filter;
import com.ryuqq.viewstore.core.query.Query;
import com.ryuqq.viewstore.core.query.Range;
import com.ryuqq.viewstore.core.query.Sort;
import com.ryuqq.viewstore.core.spi.Subscriber;
import com.ryuqq.viewstore.core.spi.Subscription;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Versioned, queryable collection of identified items.
 *
 * <p>The contract is the same for a {@link RootStore}, which owns a
 * {@link com.ryuqq.viewstore.core.spi.Storage}, and a {@link DerivedView}, which is a query
 * pipeline over a root. Mutations on a view are forwarded verbatim to its root.</p>
 *
 * <p><strong>Failures</strong> complete the returned future exceptionally:</p>
 * <ul>
 *   <li>{@code DuplicateIdException}: add of an id already present</li>
 *   <li>{@code ItemNotFoundException}: get/put/patch/delete of an absent id</li>
 *   <li>{@code TransactionFailedException}: a multi-element put/patch or a transaction failed
 *       partway; applied requests are kept</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Store&lt;Task&gt; tasks = InMemoryStores.create(Task.class, seed);
 * Store&lt;Task&gt; open = tasks.filter(tasks.createFilter().equalTo("status", "OPEN"))
 *     .sort("priority", true);
 * open.track().join();
 * open.subscribe(updates -&gt; render(updates));
 * tasks.add(new Task(null, "OPEN", 5)).join();   // open's subscribers see ItemAdded
 * </pre>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public interface Store<T> {

    // ========================================
    // Reads
    // ========================================

    /**
     * Resolves items by id at the root.
     *
     * @param ids ids in the requested order
     * @return the items; fails with {@code ItemNotFoundException} if any is absent
     */
    CompletableFuture<List<T>> get(List<String> ids);

    CompletableFuture<List<T>> get(String... ids);

    /**
     * Current data of this store.
     *
     * @return the materialized sequence
     */
    CompletableFuture<List<T>> fetch();

    /**
     * Current data with extra queries applied on top.
     *
     * @param queries additional pipeline (does not change this store)
     * @return the result
     */
    CompletableFuture<List<T>> fetch(List<Query<T>> queries);

    // ========================================
    // Mutations
    // ========================================

    /**
     * Appends items. Missing ids are generated when enabled.
     *
     * @param items items to add
     * @return the stored items; one {@code ItemAdded} per item is published as one list
     */
    CompletableFuture<List<T>> add(List<T> items);

    CompletableFuture<T> add(T item);

    /**
     * Replaces items whose id is present and adds the others.
     *
     * <p>More than one item runs as an implicit transaction publishing one batch.</p>
     *
     * @param items items to store
     * @return the stored items
     */
    CompletableFuture<List<T>> put(List<T> items);

    CompletableFuture<T> put(T item);

    /**
     * Applies patches by id. Patches for the same id are merged in submission order first.
     *
     * <p>More than one id runs as an implicit transaction publishing one batch.</p>
     *
     * @param patchSets patch sets, earliest first
     * @return the patched items
     */
    CompletableFuture<List<T>> patch(PatchSet... patchSets);

    CompletableFuture<T> patch(String id, Patch patch);

    /**
     * Removes items.
     *
     * @param ids ids to remove
     * @return the removed ids; one {@code ItemDeleted} per id is published as one list
     */
    CompletableFuture<List<String>> delete(String... ids);

    // ========================================
    // Views
    // ========================================

    Store<T> filter(Filter<T> filter);

    Store<T> filter(Predicate<? super T> predicate);

    Store<T> sort(Sort<T> sort);

    Store<T> sort(Comparator<? super T> comparator);

    Store<T> sort(Comparator<? super T> comparator, boolean descending);

    Store<T> sort(String property);

    Store<T> sort(String property, boolean descending);

    Store<T> range(Range<T> range);

    Store<T> range(int start, int count);

    // ========================================
    // Lifecycle
    // ========================================

    /**
     * Starts live tracking: the view follows root events instead of recomputing on read.
     * No-op on a root.
     *
     * @return this store, once materialized
     */
    CompletableFuture<Store<T>> track();

    /**
     * Detaches a view into an independent root over a deep copy of its current data.
     * On a root it returns the current data.
     *
     * @return the data at release time
     */
    CompletableFuture<List<T>> release();

    Transaction<T> transaction();

    Subscription subscribe(Subscriber<T> subscriber);

    // ========================================
    // Accessors
    // ========================================

    long version();

    boolean isLive();

    List<Query<T>> queries();

    /**
     * Match-all filter bound to this store's item mapper, to build property conditions on.
     *
     * @return empty filter
     */
    Filter<T> createFilter();

    String getId(T item);

    String generateId();
}
