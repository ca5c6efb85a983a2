package com.ryuqq.viewstore.core.spi;

import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.query.Query;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Backing-store SPI of a root store.
 *
 * <p>A storage holds the authoritative ordered item sequence of one root. The root store
 * serializes every call to the mutating methods, so implementations never see two mutations
 * at once.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Resolving items by id and evaluating query pipelines</li>
 *   <li>Applying single-item mutations and reporting them as update events</li>
 *   <li>Deciding whether a put is an update (id present) or an add</li>
 *   <li>Generating ids for items that arrive without one</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Failures complete the returned future exceptionally with a
 *       {@link com.ryuqq.viewstore.core.error.StoreException}; argument errors may throw
 *       {@link IllegalArgumentException} synchronously</li>
 *   <li>Event indices are positions in the storage's own order after the mutation
 *       ({@code previousIndex} before it)</li>
 *   <li>Returned lists must not be backed by internal state</li>
 * </ul>
 *
 * <p>A remote implementation would translate {@link #fetch(List)} with
 * {@link com.ryuqq.viewstore.core.query.Queries#toQueryString(List,
 * com.ryuqq.viewstore.core.query.QuerySerializer)}.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public interface Storage<T> {

    /**
     * Resolves items by id, in the requested order.
     *
     * @param ids ids to resolve
     * @return the items; fails with {@code ItemNotFoundException} if any id is absent
     */
    CompletableFuture<List<T>> get(List<String> ids);

    /**
     * Appends an item that already carries an id.
     *
     * @param item the item
     * @return the add event; fails with {@code DuplicateIdException} if the id is present
     */
    CompletableFuture<ItemAdded<T>> add(T item);

    /**
     * Replaces the stored item with the same id, keeping its position.
     *
     * @param item the new item
     * @return the update event with a lazily computed diff; fails with
     *     {@code ItemNotFoundException} if the id is absent
     */
    CompletableFuture<ItemUpdated<T>> put(T item);

    /**
     * Applies a patch to the stored item.
     *
     * @param id target id
     * @param patch patch over the item's tree form
     * @return the update event whose diff is {@code patch}; fails with
     *     {@code ItemNotFoundException} or {@code PatchApplicationException}
     */
    CompletableFuture<ItemUpdated<T>> patch(String id, Patch patch);

    /**
     * Removes an item and shifts its followers down.
     *
     * @param id the id
     * @return the delete event; fails with {@code ItemNotFoundException} if the id is absent
     */
    CompletableFuture<ItemDeleted<T>> delete(String id);

    /**
     * Evaluates a query pipeline over the current data.
     *
     * @param queries pipeline (empty for the whole sequence)
     * @return matching items in pipeline order
     */
    CompletableFuture<List<T>> fetch(List<Query<T>> queries);

    /**
     * Whether a put of this item replaces an existing one.
     *
     * @param item the item
     * @return true if its id is present
     */
    boolean isUpdate(T item);

    String generateId();

    ItemIdentity<T> identity();

    ItemMapper<T> mapper();
}
