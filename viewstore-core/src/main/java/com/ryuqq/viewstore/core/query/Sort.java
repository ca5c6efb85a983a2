package com.ryuqq.viewstore.core.query;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.util.JsonNodes;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Stable ordering, by property path or by an opaque comparator.
 *
 * <p>Property sorts compare tree values: absent and null first, numbers numerically, text
 * lexicographically, booleans false before true. {@code descending} negates the comparison,
 * so ties keep their input order in both directions.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class Sort<T> implements Query<T> {

    private final String property;
    private final JsonPointer pointer;
    private final ItemMapper<T> mapper;
    private final Comparator<? super T> custom;
    private final boolean descending;

    private Sort(String property, ItemMapper<T> mapper, Comparator<? super T> custom, boolean descending) {
        this.property = property;
        this.pointer = property == null ? null : JsonNodes.pointer(property);
        this.mapper = mapper;
        this.custom = custom;
        this.descending = descending;
    }

    public static <T> Sort<T> by(ItemMapper<T> mapper, String property) {
        return by(mapper, property, false);
    }

    /**
     * Sort by a property of the tree form.
     *
     * @param mapper item mapper
     * @param property dot path or JSON pointer
     * @param descending whether to reverse the order
     * @param <T> item type
     * @return serializable sort
     * @throws IllegalArgumentException if mapper or property is null
     */
    public static <T> Sort<T> by(ItemMapper<T> mapper, String property, boolean descending) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        return new Sort<>(property, mapper, null, descending);
    }

    public static <T> Sort<T> by(Comparator<? super T> comparator) {
        return by(comparator, false);
    }

    /**
     * Sort by an opaque comparator. It has no query-string form.
     *
     * @param comparator item comparator
     * @param descending whether to reverse the order
     * @param <T> item type
     * @return custom sort
     * @throws IllegalArgumentException if comparator is null
     */
    public static <T> Sort<T> by(Comparator<? super T> comparator, boolean descending) {
        if (comparator == null) {
            throw new IllegalArgumentException("comparator cannot be null");
        }
        return new Sort<>(null, null, comparator, descending);
    }

    /**
     * @return same key, opposite direction
     */
    public Sort<T> reversed() {
        return new Sort<>(property, mapper, custom, !descending);
    }

    /**
     * Effective comparator, direction included.
     *
     * @return comparator over items
     */
    public Comparator<T> comparator() {
        Comparator<T> base;
        if (custom != null) {
            base = custom::compare;
        } else {
            base = (a, b) -> JsonNodes.compare(key(a), key(b));
        }
        return descending ? base.reversed() : base;
    }

    @Override
    public QueryType kind() {
        return QueryType.SORT;
    }

    @Override
    public List<T> apply(List<T> data) {
        if (custom != null) {
            List<T> sorted = new ArrayList<>(data);
            sorted.sort(comparator());
            return sorted;
        }
        // compute each key once
        List<Keyed<T>> keyed = new ArrayList<>(data.size());
        for (T item : data) {
            keyed.add(new Keyed<>(item, key(item)));
        }
        Comparator<Keyed<T>> byKey = (a, b) -> JsonNodes.compare(a.key, b.key);
        keyed.sort(descending ? byKey.reversed() : byKey);
        List<T> sorted = new ArrayList<>(keyed.size());
        for (Keyed<T> entry : keyed) {
            sorted.add(entry.item);
        }
        return sorted;
    }

    @Override
    public boolean isSerializable() {
        return property != null;
    }

    @Override
    public String toQueryString(QuerySerializer serializer) {
        return serializer.serializeSort(this);
    }

    /**
     * Sort property.
     *
     * @return property path, or null for a comparator sort
     */
    public String property() {
        return property;
    }

    public boolean isDescending() {
        return descending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Sort)) {
            return false;
        }
        Sort<?> that = (Sort<?>) o;
        return descending == that.descending
            && Objects.equals(property, that.property)
            && Objects.equals(custom, that.custom);
    }

    @Override
    public int hashCode() {
        return Objects.hash(property, custom, descending);
    }

    @Override
    public String toString() {
        return "Sort[" + (property != null ? property : "comparator") + (descending ? " desc" : " asc") + "]";
    }

    private JsonNode key(T item) {
        return mapper.toTree(item).at(pointer);
    }

    private static final class Keyed<T> {
        private final T item;
        private final JsonNode key;

        private Keyed(T item, JsonNode key) {
            this.item = item;
            this.key = key;
        }
    }
}
