package com.ryuqq.viewstore.application.store;

import com.ryuqq.viewstore.application.propagation.UpdatePropagator;
import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.query.Filter;
import com.ryuqq.viewstore.core.query.Range;
import com.ryuqq.viewstore.core.query.Sort;
import com.ryuqq.viewstore.core.spi.Subscriber;
import com.ryuqq.viewstore.core.spi.Subscription;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Convenience overloads and subscriber handling shared by roots and views.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public abstract class AbstractStore<T> implements Store<T> {

    protected final UpdatePropagator<T> propagator;

    protected AbstractStore(String name) {
        this.propagator = new UpdatePropagator<>(name);
    }

    protected abstract ItemIdentity<T> identity();

    protected abstract ItemMapper<T> mapper();

    @Override
    public CompletableFuture<List<T>> get(String... ids) {
        return get(Arrays.asList(ids));
    }

    @Override
    public CompletableFuture<List<T>> fetch() {
        return fetch(List.of());
    }

    @Override
    public CompletableFuture<T> add(T item) {
        return add(List.of(requireItem(item))).thenApply(items -> items.get(0));
    }

    @Override
    public CompletableFuture<T> put(T item) {
        return put(List.of(requireItem(item))).thenApply(items -> items.get(0));
    }

    @Override
    public CompletableFuture<T> patch(String id, Patch patch) {
        return patch(PatchSet.of(id, patch)).thenApply(items -> items.get(0));
    }

    @Override
    public Store<T> filter(Predicate<? super T> predicate) {
        return filter(Filter.custom(mapper(), predicate));
    }

    @Override
    public Store<T> sort(Comparator<? super T> comparator) {
        return sort(Sort.by(comparator));
    }

    @Override
    public Store<T> sort(Comparator<? super T> comparator, boolean descending) {
        return sort(Sort.by(comparator, descending));
    }

    @Override
    public Store<T> sort(String property) {
        return sort(Sort.by(mapper(), property));
    }

    @Override
    public Store<T> sort(String property, boolean descending) {
        return sort(Sort.by(mapper(), property, descending));
    }

    @Override
    public Store<T> range(int start, int count) {
        return range(Range.of(start, count));
    }

    @Override
    public Subscription subscribe(Subscriber<T> subscriber) {
        return propagator.subscribe(subscriber);
    }

    @Override
    public Filter<T> createFilter() {
        return Filter.where(mapper());
    }

    @Override
    public String getId(T item) {
        return identity().getId(requireItem(item));
    }

    private static <T> T requireItem(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        return item;
    }
}
