package com.ryuqq.viewstore.application.store;

import com.ryuqq.viewstore.application.transaction.ExecutionResult;
import com.ryuqq.viewstore.application.transaction.MutationRequest;
import com.ryuqq.viewstore.application.transaction.MutationSequencer;
import com.ryuqq.viewstore.application.transaction.MutationTarget;
import com.ryuqq.viewstore.application.transaction.SimpleTransaction;
import com.ryuqq.viewstore.application.transaction.Transaction;
import com.ryuqq.viewstore.application.transaction.TransactionExecutor;
import com.ryuqq.viewstore.core.config.StoreConfig;
import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.query.Filter;
import com.ryuqq.viewstore.core.query.Query;
import com.ryuqq.viewstore.core.query.Range;
import com.ryuqq.viewstore.core.query.Sort;
import com.ryuqq.viewstore.core.spi.Storage;
import com.ryuqq.viewstore.core.spi.StorageFactory;
import com.ryuqq.viewstore.core.spi.Subscriber;
import com.ryuqq.viewstore.core.spi.Subscription;
import com.ryuqq.viewstore.core.update.BatchUpdate;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;
import com.ryuqq.viewstore.core.update.Update;
import com.ryuqq.viewstore.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Store that owns a {@link Storage}: the authoritative end of every mutation.
 *
 * <p><strong>Mutation flow:</strong></p>
 * <pre>
 * 1. The call is queued on the MutationSequencer (one mutation in flight per root)
 * 2. Requests run against the storage one by one; each success advances the version by 1
 * 3. The resulting events are published once: subscribers first, then tracking views
 * 4. The returned future completes after publication
 * </pre>
 *
 * <p><strong>Event shapes:</strong></p>
 * <ul>
 *   <li>add / delete: one leaf event per item, delivered as one list</li>
 *   <li>put / patch of one element: one leaf event</li>
 *   <li>put / patch of several elements, transactions: one {@link BatchUpdate}</li>
 * </ul>
 *
 * <p>When a call fails partway, the events of the requests already applied are published in
 * the same shape before the failure is reported.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class RootStore<T> extends AbstractStore<T> implements MutationTarget<T> {

    private static final Logger log = LoggerFactory.getLogger(RootStore.class);

    private final StorageFactory<T> storageFactory;
    private final Storage<T> storage;
    private final StoreConfig config;
    private final ViewFactory<T> viewFactory;
    private final MutationSequencer sequencer = new MutationSequencer();
    private final AtomicLong version;

    /**
     * Root with the default configuration and view factory.
     *
     * @param storageFactory builds this root's storage (and the storages of released views)
     * @param seed initial items
     * @throws IllegalArgumentException if an argument is null
     */
    public RootStore(StorageFactory<T> storageFactory, List<T> seed) {
        this(storageFactory, seed, new StoreConfig(), ViewFactory.defaultFactory());
    }

    /**
     * Creates a root at version 1.
     *
     * @param storageFactory builds this root's storage (and the storages of released views)
     * @param seed initial items
     * @param config configuration
     * @param viewFactory builds the views returned by filter, sort and range
     * @throws IllegalArgumentException if an argument is null
     */
    public RootStore(StorageFactory<T> storageFactory, List<T> seed, StoreConfig config, ViewFactory<T> viewFactory) {
        this(storageFactory, seed, config, viewFactory, 1L);
    }

    private RootStore(StorageFactory<T> storageFactory,
                      List<T> seed,
                      StoreConfig config,
                      ViewFactory<T> viewFactory,
                      long initialVersion) {
        super("RootStore");
        if (storageFactory == null) {
            throw new IllegalArgumentException("storageFactory cannot be null");
        }
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (viewFactory == null) {
            throw new IllegalArgumentException("viewFactory cannot be null");
        }
        this.storageFactory = storageFactory;
        this.storage = storageFactory.create(seed);
        this.config = config;
        this.viewFactory = viewFactory;
        this.version = new AtomicLong(initialVersion);
    }

    // ========================================
    // Reads
    // ========================================

    @Override
    public CompletableFuture<List<T>> get(List<String> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        return storage.get(List.copyOf(ids));
    }

    @Override
    public CompletableFuture<List<T>> fetch(List<Query<T>> queries) {
        if (queries == null) {
            throw new IllegalArgumentException("queries cannot be null");
        }
        return storage.fetch(List.copyOf(queries));
    }

    // ========================================
    // Mutations
    // ========================================

    @Override
    public CompletableFuture<List<T>> add(List<T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        List<MutationRequest<T>> requests = new ArrayList<>(items.size());
        for (T item : items) {
            requests.add(new MutationRequest.AddRequest<>(item));
        }
        return executeImplicit(requests, false).thenApply(RootStore::itemsOf);
    }

    @Override
    public CompletableFuture<List<T>> put(List<T> items) {
        if (items == null) {
            throw new IllegalArgumentException("items cannot be null");
        }
        List<MutationRequest<T>> requests = new ArrayList<>(items.size());
        for (T item : items) {
            requests.add(new MutationRequest.PutRequest<>(item));
        }
        return executeImplicit(requests, requests.size() > 1).thenApply(RootStore::itemsOf);
    }

    @Override
    public CompletableFuture<List<T>> patch(PatchSet... patchSets) {
        PatchSet merged = PatchSet.mergeAll(Arrays.asList(patchSets));
        List<MutationRequest<T>> requests = new ArrayList<>(merged.size());
        for (Map.Entry<String, Patch> entry : merged.asMap().entrySet()) {
            requests.add(new MutationRequest.PatchRequest<>(entry.getKey(), entry.getValue()));
        }
        return executeImplicit(requests, requests.size() > 1).thenApply(RootStore::itemsOf);
    }

    @Override
    public CompletableFuture<List<String>> delete(String... ids) {
        List<MutationRequest<T>> requests = new ArrayList<>(ids.length);
        for (String id : ids) {
            requests.add(new MutationRequest.DeleteRequest<>(id));
        }
        return executeImplicit(requests, false).thenApply(updates -> {
            List<String> deleted = new ArrayList<>(updates.size());
            for (Update<T> update : updates) {
                deleted.add(((ItemDeleted<T>) update).id());
            }
            return deleted;
        });
    }

    @Override
    public Transaction<T> transaction() {
        return new SimpleTransaction<>(this);
    }

    // ========================================
    // Views
    // ========================================

    @Override
    public DerivedView<T> filter(Filter<T> filter) {
        return view(List.of(filter));
    }

    @Override
    public DerivedView<T> sort(Sort<T> sort) {
        return view(List.of(sort));
    }

    @Override
    public DerivedView<T> range(Range<T> range) {
        return view(List.of(range));
    }

    @Override
    public CompletableFuture<Store<T>> track() {
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public CompletableFuture<List<T>> release() {
        return fetch();
    }

    // ========================================
    // Accessors
    // ========================================

    @Override
    public long version() {
        return version.get();
    }

    @Override
    public boolean isLive() {
        return false;
    }

    @Override
    public List<Query<T>> queries() {
        return List.of();
    }

    @Override
    public String generateId() {
        return storage.generateId();
    }

    @Override
    protected ItemIdentity<T> identity() {
        return storage.identity();
    }

    @Override
    protected ItemMapper<T> mapper() {
        return storage.mapper();
    }

    // ========================================
    // MutationTarget
    // ========================================

    @Override
    public CompletableFuture<ItemAdded<T>> applyAdd(T item) {
        T stored = item;
        if (identity().getId(item) == null) {
            if (!config.generateIds()) {
                return CompletableFuture.failedFuture(
                    new IllegalArgumentException("item has no id and id generation is disabled: " + item));
            }
            stored = identity().withId(item, storage.generateId());
        }
        return storage.add(stored).thenApply(this::applied);
    }

    @Override
    public CompletableFuture<ItemUpdated<T>> applyPut(T item) {
        return storage.put(item).thenApply(this::applied);
    }

    @Override
    public CompletableFuture<ItemUpdated<T>> applyPatch(String id, Patch patch) {
        return storage.patch(id, patch).thenApply(this::applied);
    }

    @Override
    public CompletableFuture<ItemDeleted<T>> applyDelete(String id) {
        return storage.delete(id).thenApply(this::applied);
    }

    @Override
    public boolean isUpdate(T item) {
        return storage.isUpdate(item);
    }

    @Override
    public void publish(List<Update<T>> updates) {
        propagator.publish(updates);
    }

    @Override
    public <R> CompletableFuture<R> sequence(Supplier<? extends CompletableFuture<R>> task) {
        return sequencer.submit(task);
    }

    // ========================================
    // Hierarchy support for DerivedView
    // ========================================

    DerivedView<T> view(List<Query<T>> queries) {
        return viewFactory.create(this, List.copyOf(queries));
    }

    boolean copiesOnRead() {
        return config.copyOnRead();
    }

    Subscription registerTrackingView(Subscriber<T> view) {
        return propagator.track(view);
    }

    /**
     * Independent root over a private copy of data, sharing this root's factories.
     *
     * @param data seed of the new root
     * @param initialVersion version the new root starts at
     * @return detached root
     */
    RootStore<T> spawnRoot(List<T> data, long initialVersion) {
        return new RootStore<>(storageFactory, data, config, viewFactory, initialVersion);
    }

    private <U extends Update<T>> U applied(U update) {
        long current = version.incrementAndGet();
        log.debug("Applied {} to storage, version {}", update.type(), current);
        return update;
    }

    private CompletableFuture<List<Update<T>>> executeImplicit(List<MutationRequest<T>> requests, boolean batch) {
        if (requests.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        return sequencer.submit(() -> TransactionExecutor.execute(this, requests).thenApply(result -> {
            publish(shape(result.applied(), batch));
            if (result.isSuccess()) {
                return result.applied();
            }
            throw failure(result, batch);
        }));
    }

    private RuntimeException failure(ExecutionResult<T> result, boolean batch) {
        if (batch) {
            log.warn("Batch stopped at request {}; {} applied request(s) kept",
                result.failedIndex(), result.applied().size(), result.failure());
            return result.toException();
        }
        Throwable cause = result.failure();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return Futures.propagate(cause);
    }

    private static <T> List<Update<T>> shape(List<Update<T>> updates, boolean batch) {
        if (!batch || updates.isEmpty()) {
            return updates;
        }
        return List.of(new BatchUpdate<>(updates));
    }

    private static <T> List<T> itemsOf(List<Update<T>> updates) {
        List<T> items = new ArrayList<>(updates.size());
        for (Update<T> update : updates) {
            if (update instanceof ItemAdded) {
                items.add(((ItemAdded<T>) update).item());
            } else if (update instanceof ItemUpdated) {
                items.add(((ItemUpdated<T>) update).item());
            }
        }
        return items;
    }
}
