package com.ryuqq.viewstore.adapter.inmemory;

import com.ryuqq.viewstore.core.config.StoreConfig;
import com.ryuqq.viewstore.core.error.DuplicateIdException;
import com.ryuqq.viewstore.core.error.ItemNotFoundException;
import com.ryuqq.viewstore.core.error.PatchApplicationException;
import com.ryuqq.viewstore.core.error.StoreException;
import com.ryuqq.viewstore.core.model.IndexedData;
import com.ryuqq.viewstore.core.model.IndexedEntry;
import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Diff;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.query.Queries;
import com.ryuqq.viewstore.core.query.Query;
import com.ryuqq.viewstore.core.spi.Storage;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * In-memory implementation of {@link Storage} SPI for testing and reference purposes.
 *
 * <p>Items live in one {@link IndexedData} (ordered list plus id map). Every call completes
 * before returning; failures are returned as exceptionally completed futures.</p>
 *
 * <p><strong>Ownership:</strong> with {@link StoreConfig#copyOnRead()} enabled the storage keeps
 * deep copies of seed, added and put items and hands out deep copies on {@code get} and
 * {@code fetch}, so no caller holds a reference into the stored data. Event payloads carry the
 * stored instance and must be treated as read-only. With copying disabled, items are shared.</p>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>get / isUpdate / put / patch:</strong> O(1) id lookup</li>
 *   <li><strong>add:</strong> amortized O(1) append</li>
 *   <li><strong>delete:</strong> O(N) re-indexing of followers</li>
 *   <li><strong>fetch:</strong> O(N) per pipeline step, plus O(N log N) per sort</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not thread-safe on its own; the owning root store sequences mutations</li>
 * </ul>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public class InMemoryStorage<T> implements Storage<T> {

    private final ItemMapper<T> mapper;
    private final ItemIdentity<T> identity;
    private final StoreConfig config;
    private final IndexedData<T> data;

    /**
     * Creates a storage over seed data.
     *
     * <p>Seed items without an id receive a generated one when id generation is enabled.</p>
     *
     * @param mapper item mapper
     * @param identity id accessor
     * @param config store configuration
     * @param seed initial items
     * @throws DuplicateIdException if two seed items share an id
     */
    public InMemoryStorage(ItemMapper<T> mapper, ItemIdentity<T> identity, StoreConfig config, List<T> seed) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (seed == null) {
            throw new IllegalArgumentException("seed cannot be null");
        }
        this.mapper = mapper;
        this.identity = identity;
        this.config = config;
        this.data = new IndexedData<>(identity::getId);
        List<T> identified = new ArrayList<>(seed.size());
        for (T item : seed) {
            if (item != null && identity.getId(item) == null && config.generateIds()) {
                identified.add(detach(identity.withId(item, generateId())));
            } else {
                identified.add(detach(item));
            }
        }
        data.reset(identified);
    }

    @Override
    public CompletableFuture<List<T>> get(List<String> ids) {
        return attempt(() -> {
            List<T> items = new ArrayList<>(ids.size());
            for (String id : ids) {
                IndexedEntry<T> entry = data.entry(id);
                if (entry == null) {
                    throw new ItemNotFoundException(id);
                }
                items.add(detach(entry.item()));
            }
            return items;
        });
    }

    @Override
    public CompletableFuture<ItemAdded<T>> add(T item) {
        return attempt(() -> {
            String id = requireId(item);
            if (data.contains(id)) {
                throw new DuplicateIdException(id);
            }
            T stored = detach(item);
            int index = data.append(stored);
            return new ItemAdded<>(id, stored, index);
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>The item keeps its position; the diff against the replaced item is computed lazily.</p>
     */
    @Override
    public CompletableFuture<ItemUpdated<T>> put(T item) {
        return attempt(() -> {
            String id = requireId(item);
            IndexedEntry<T> entry = data.entry(id);
            if (entry == null) {
                throw new ItemNotFoundException(id);
            }
            T previous = entry.item();
            T stored = detach(item);
            int index = data.replace(id, stored);
            return new ItemUpdated<>(id, stored, index, index, () -> Diff.between(previous, stored, mapper));
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>The submitted patch is reported as the event's diff. A patch that changes the id
     * property is rejected.</p>
     */
    @Override
    public CompletableFuture<ItemUpdated<T>> patch(String id, Patch patch) {
        return attempt(() -> {
            IndexedEntry<T> entry = data.entry(id);
            if (entry == null) {
                throw new ItemNotFoundException(id);
            }
            T patched = patch.apply(entry.item(), mapper);
            if (!id.equals(identity.getId(patched))) {
                throw new PatchApplicationException("Patch for '" + id + "' must not change the item id");
            }
            int index = data.replace(id, patched);
            return ItemUpdated.withPatch(id, patched, index, index, patch);
        });
    }

    @Override
    public CompletableFuture<ItemDeleted<T>> delete(String id) {
        return attempt(() -> new ItemDeleted<>(id, data.remove(id)));
    }

    @Override
    public CompletableFuture<List<T>> fetch(List<Query<T>> queries) {
        return attempt(() -> {
            List<T> result = Queries.applyAll(queries, data.snapshot());
            if (!config.copyOnRead()) {
                return result;
            }
            return mapper.copyAll(result);
        });
    }

    @Override
    public boolean isUpdate(T item) {
        String id = identity.getId(item);
        return id != null && data.contains(id);
    }

    @Override
    public String generateId() {
        return UUID.randomUUID().toString();
    }

    @Override
    public ItemIdentity<T> identity() {
        return identity;
    }

    @Override
    public ItemMapper<T> mapper() {
        return mapper;
    }

    /**
     * Number of stored items.
     *
     * @return item count
     */
    public int size() {
        return data.size();
    }

    /**
     * Checks the id map against the ordered data.
     *
     * @return true if every map entry points at its item's position
     */
    public boolean isConsistent() {
        return data.isConsistent();
    }

    private T detach(T item) {
        return config.copyOnRead() ? mapper.copy(item) : item;
    }

    private String requireId(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        String id = identity.getId(item);
        if (id == null) {
            throw new IllegalArgumentException("item has no id: " + item);
        }
        return id;
    }

    private static <R> CompletableFuture<R> attempt(Supplier<R> action) {
        try {
            return CompletableFuture.completedFuture(action.get());
        } catch (StoreException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
