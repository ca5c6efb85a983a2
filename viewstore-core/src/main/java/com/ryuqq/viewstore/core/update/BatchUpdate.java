package com.ryuqq.viewstore.core.update;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered results of one transaction, delivered as a single event.
 *
 * @param updates per-request results in execution order (never nested batches)
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public record BatchUpdate<T>(List<Update<T>> updates) implements Update<T> {

    public BatchUpdate {
        if (updates == null) {
            throw new IllegalArgumentException("updates cannot be null");
        }
        updates = List.copyOf(updates);
    }

    @Override
    public UpdateType type() {
        return UpdateType.BATCH;
    }

    @Override
    public List<Update<T>> leaves() {
        List<Update<T>> leaves = new ArrayList<>(updates.size());
        for (Update<T> update : updates) {
            leaves.addAll(update.leaves());
        }
        return leaves;
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }
}
