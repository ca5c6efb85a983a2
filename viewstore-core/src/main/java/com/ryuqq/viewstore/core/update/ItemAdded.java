package com.ryuqq.viewstore.core.update;

import java.util.List;

/**
 * An item was added.
 *
 * @param id item id
 * @param item the stored item
 * @param index position in the publishing store
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public record ItemAdded<T>(String id, T item, int index) implements Update<T> {

    public ItemAdded {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    @Override
    public UpdateType type() {
        return UpdateType.ADDED;
    }

    @Override
    public List<Update<T>> leaves() {
        return List.of(this);
    }
}
