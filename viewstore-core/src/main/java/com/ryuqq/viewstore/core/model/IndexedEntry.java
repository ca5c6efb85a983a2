package com.ryuqq.viewstore.core.model;

/**
 * An item bound to its current position in a store's ordered data.
 *
 * @param item the item
 * @param index zero-based position
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public record IndexedEntry<T>(T item, int index) {

    public IndexedEntry {
        if (index < 0) {
            throw new IllegalArgumentException("index cannot be negative, but was: " + index);
        }
    }
}
