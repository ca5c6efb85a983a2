package com.ryuqq.viewstore.core.update;

import java.util.List;

/**
 * Mutation event delivered to subscribers and tracking views.
 *
 * <p>Four variants:</p>
 * <ul>
 *   <li>{@link ItemAdded}: an item entered the store at {@code index}</li>
 *   <li>{@link ItemUpdated}: an item changed, possibly moving from {@code previousIndex}</li>
 *   <li>{@link ItemDeleted}: an item left the store from {@code index}</li>
 *   <li>{@link BatchUpdate}: the ordered results of one transaction</li>
 * </ul>
 *
 * <p>Indices are relative to the store that publishes the event. {@link #NO_INDEX} means
 * "not present in this store".</p>
 *
 * <p><strong>Dispatch example:</strong></p>
 * <pre>
 * if (update instanceof ItemAdded&lt;T&gt; added) {
 *     render(added.item(), added.index());
 * } else if (update instanceof BatchUpdate&lt;T&gt; batch) {
 *     batch.leaves().forEach(this::apply);
 * }
 * </pre>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public sealed interface Update<T> permits ItemAdded, ItemUpdated, ItemDeleted, BatchUpdate {

    int NO_INDEX = -1;

    UpdateType type();

    /**
     * Non-batch events in delivery order.
     *
     * @return this event, or the flattened contents of a batch
     */
    List<Update<T>> leaves();

    /**
     * Number of leaf events, i.e. the number of version increments this event stands for.
     *
     * @return leaf count
     */
    default int leafCount() {
        return leaves().size();
    }

    /**
     * Leaf count over a delivered list.
     *
     * @param updates delivered list
     * @param <T> item type
     * @return total leaf count
     */
    static <T> int leafCount(List<? extends Update<T>> updates) {
        int count = 0;
        for (Update<T> update : updates) {
            count += update.leafCount();
        }
        return count;
    }
}
