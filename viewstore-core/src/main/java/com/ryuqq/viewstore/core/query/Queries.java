package com.ryuqq.viewstore.core.query;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.StringJoiner;
import java.util.function.Predicate;

/**
 * Operations over query pipelines.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class Queries {

    private Queries() {
    }

    /**
     * Applies queries left to right.
     *
     * @param queries pipeline
     * @param data input (not modified)
     * @param <T> item type
     * @return a new list
     */
    public static <T> List<T> applyAll(List<? extends Query<T>> queries, List<T> data) {
        List<T> result = new ArrayList<>(data);
        for (Query<T> query : queries) {
            result = query.apply(result);
        }
        return result;
    }

    /**
     * Default query-string form of a pipeline.
     *
     * @param queries pipeline
     * @return parts joined with {@code &}
     * @throws com.ryuqq.viewstore.core.error.NotSerializableQueryException if a query is opaque
     */
    public static String toQueryString(List<? extends Query<?>> queries) {
        return toQueryString(queries, RqlQuerySerializer.INSTANCE);
    }

    /**
     * Query string of a whole pipeline, parts joined by {@code &}.
     *
     * @param queries pipeline
     * @param serializer output format
     * @return joined query string (empty parts skipped)
     */
    public static String toQueryString(List<? extends Query<?>> queries, QuerySerializer serializer) {
        StringJoiner joiner = new StringJoiner("&");
        for (Query<?> query : queries) {
            String part = query.toQueryString(serializer);
            if (!part.isEmpty()) {
                joiner.add(part);
            }
        }
        return joiner.toString();
    }

    /**
     * @param queries pipeline
     * @return whether any step is a range
     */
    public static boolean hasRange(List<? extends Query<?>> queries) {
        for (Query<?> query : queries) {
            if (query.kind() == QueryType.RANGE) {
                return true;
            }
        }
        return false;
    }

    /**
     * Conjunction of every filter in a pipeline.
     *
     * @param queries pipeline
     * @param <T> item type
     * @return combined predicate (always true when there is no filter)
     */
    public static <T> Predicate<T> predicate(List<? extends Query<T>> queries) {
        List<Filter<T>> filters = new ArrayList<>();
        for (Query<T> query : queries) {
            if (query instanceof Filter) {
                filters.add((Filter<T>) query);
            }
        }
        return item -> {
            for (Filter<T> filter : filters) {
                if (!filter.test(item)) {
                    return false;
                }
            }
            return true;
        };
    }

    /**
     * Ordering equivalent to applying a pipeline's sorts in sequence.
     *
     * <p>Sorts are stable, so the last sort is the primary key and earlier sorts break its ties.
     * Filters do not change relative order and are ignored.</p>
     *
     * @param queries pipeline
     * @param <T> item type
     * @return composed comparator, or null when the pipeline has no sort
     */
    public static <T> Comparator<T> comparator(List<? extends Query<T>> queries) {
        Comparator<T> composed = null;
        for (int i = queries.size() - 1; i >= 0; i--) {
            Query<T> query = queries.get(i);
            if (query instanceof Sort) {
                Comparator<T> next = ((Sort<T>) query).comparator();
                composed = composed == null ? next : composed.thenComparing(next);
            }
        }
        return composed;
    }
}
