package com.ryuqq.viewstore.testkit;

import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.query.Query;
import com.ryuqq.viewstore.core.spi.Storage;
import com.ryuqq.viewstore.core.spi.StorageFactory;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link Storage} decorator counting read calls, to tell cache hits from recomputations.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public class CountingStorage<T> implements Storage<T> {

    private final Storage<T> delegate;
    private final AtomicInteger fetchCount = new AtomicInteger();
    private final AtomicInteger getCount = new AtomicInteger();

    /**
     * @param delegate storage receiving every call
     * @throws IllegalArgumentException if delegate is null
     */
    public CountingStorage(Storage<T> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    /**
     * Wraps every storage a factory creates.
     *
     * @param delegate underlying factory
     * @param <T> item type
     * @return counting factory
     */
    public static <T> Factory<T> factory(StorageFactory<T> delegate) {
        return new Factory<>(delegate);
    }

    public int fetchCount() {
        return fetchCount.get();
    }

    public int getCount() {
        return getCount.get();
    }

    @Override
    public CompletableFuture<List<T>> get(List<String> ids) {
        getCount.incrementAndGet();
        return delegate.get(ids);
    }

    @Override
    public CompletableFuture<ItemAdded<T>> add(T item) {
        return delegate.add(item);
    }

    @Override
    public CompletableFuture<ItemUpdated<T>> put(T item) {
        return delegate.put(item);
    }

    @Override
    public CompletableFuture<ItemUpdated<T>> patch(String id, Patch patch) {
        return delegate.patch(id, patch);
    }

    @Override
    public CompletableFuture<ItemDeleted<T>> delete(String id) {
        return delegate.delete(id);
    }

    @Override
    public CompletableFuture<List<T>> fetch(List<Query<T>> queries) {
        fetchCount.incrementAndGet();
        return delegate.fetch(queries);
    }

    @Override
    public boolean isUpdate(T item) {
        return delegate.isUpdate(item);
    }

    @Override
    public String generateId() {
        return delegate.generateId();
    }

    @Override
    public ItemIdentity<T> identity() {
        return delegate.identity();
    }

    @Override
    public ItemMapper<T> mapper() {
        return delegate.mapper();
    }

    /**
     * Factory remembering the storages it created, oldest first.
     *
     * @param <T> item type
     */
    public static final class Factory<T> implements StorageFactory<T> {

        private final StorageFactory<T> delegate;
        private final List<CountingStorage<T>> created = new ArrayList<>();

        private Factory(StorageFactory<T> delegate) {
            if (delegate == null) {
                throw new IllegalArgumentException("delegate cannot be null");
            }
            this.delegate = delegate;
        }

        @Override
        public synchronized Storage<T> create(List<T> seed) {
            CountingStorage<T> storage = new CountingStorage<>(delegate.create(seed));
            created.add(storage);
            return storage;
        }

        /**
         * @return every storage created so far, in creation order
         */
        public synchronized List<CountingStorage<T>> created() {
            return List.copyOf(created);
        }

        /**
         * Storage of the first root built with this factory.
         *
         * @return first created storage
         * @throws IllegalStateException if none was created yet
         */
        public synchronized CountingStorage<T> first() {
            if (created.isEmpty()) {
                throw new IllegalStateException("no storage created yet");
            }
            return created.get(0);
        }
    }
}
