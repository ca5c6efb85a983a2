package com.ryuqq.viewstore.core.update;

import java.util.List;

/**
 * An item was removed.
 *
 * @param id item id
 * @param index position the item occupied in the publishing store
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public record ItemDeleted<T>(String id, int index) implements Update<T> {

    public ItemDeleted {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
    }

    public ItemDeleted<T> withIndex(int newIndex) {
        return new ItemDeleted<>(id, newIndex);
    }

    @Override
    public UpdateType type() {
        return UpdateType.DELETED;
    }

    @Override
    public List<Update<T>> leaves() {
        return List.of(this);
    }
}
