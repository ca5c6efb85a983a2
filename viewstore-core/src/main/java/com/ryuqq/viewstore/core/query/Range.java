package com.ryuqq.viewstore.core.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Window {@code [start, start + count)} of the input, clamped to its bounds.
 *
 * @param start first position (non-negative)
 * @param count window size (non-negative; 0 yields an empty result)
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public record Range<T>(int start, int count) implements Query<T> {

    public Range {
        if (start < 0) {
            throw new IllegalArgumentException("start cannot be negative: " + start);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
    }

    /**
     * @param start first position
     * @param count maximum number of items
     * @param <T> item type
     * @return range
     * @throws IllegalArgumentException if start or count is negative
     */
    public static <T> Range<T> of(int start, int count) {
        return new Range<>(start, count);
    }

    @Override
    public QueryType kind() {
        return QueryType.RANGE;
    }

    @Override
    public List<T> apply(List<T> data) {
        int from = Math.min(start, data.size());
        int to = (int) Math.min((long) start + count, data.size());
        return new ArrayList<>(data.subList(from, to));
    }

    @Override
    public boolean isSerializable() {
        return true;
    }

    @Override
    public String toQueryString(QuerySerializer serializer) {
        return serializer.serializeRange(this);
    }
}
