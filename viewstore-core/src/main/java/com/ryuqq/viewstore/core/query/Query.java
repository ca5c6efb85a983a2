package com.ryuqq.viewstore.core.query;

import com.ryuqq.viewstore.core.error.NotSerializableQueryException;

import java.util.List;

/**
 * One step of a view's query pipeline.
 *
 * <p>Queries are immutable and {@link #apply(List)} is pure: it never mutates its input and
 * always returns a new list. A view applies its queries in insertion order.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public sealed interface Query<T> permits Filter, Sort, Range {

    QueryType kind();

    /**
     * Applies this step.
     *
     * @param data input sequence (not modified)
     * @return a new list
     */
    List<T> apply(List<T> data);

    /**
     * True if this query has a query-string form.
     *
     * @return false for opaque predicates and comparators
     */
    boolean isSerializable();

    /**
     * Query-string form using the given serializer.
     *
     * @param serializer output format
     * @return the query string
     * @throws NotSerializableQueryException if this query wraps opaque code
     */
    String toQueryString(QuerySerializer serializer);

    /**
     * Query-string form in the default RQL syntax.
     *
     * @return the query string
     * @throws NotSerializableQueryException if this query wraps opaque code
     */
    default String toQueryString() {
        return toQueryString(RqlQuerySerializer.INSTANCE);
    }
}
