package com.ryuqq.viewstore.adapter.inmemory;

import com.ryuqq.viewstore.application.store.RootStore;
import com.ryuqq.viewstore.application.store.ViewFactory;
import com.ryuqq.viewstore.core.config.StoreConfig;
import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.spi.StorageFactory;

import java.util.List;

/**
 * Entry point for in-memory stores.
 *
 * <pre>
 * RootStore&lt;Task&gt; tasks = InMemoryStores.create(Task.class, List.of(t1, t2));
 * </pre>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class InMemoryStores {

    private InMemoryStores() {
    }

    /**
     * Empty store of Jackson-mappable items with the default configuration.
     *
     * @param type item class
     * @param <T> item type
     * @return new root store
     */
    public static <T> RootStore<T> create(Class<T> type) {
        return create(type, List.of());
    }

    /**
     * Store over seed items with the default configuration.
     *
     * @param type item class
     * @param seed initial items
     * @param <T> item type
     * @return new root store
     * @throws com.ryuqq.viewstore.core.error.DuplicateIdException if two seed items share an id
     */
    public static <T> RootStore<T> create(Class<T> type, List<T> seed) {
        return create(type, seed, new StoreConfig());
    }

    /**
     * Store of Jackson-mappable items identified by {@link StoreConfig#idProperty()}.
     *
     * @param type item class
     * @param seed initial items
     * @param config configuration
     * @param <T> item type
     * @return new root store
     */
    public static <T> RootStore<T> create(Class<T> type, List<T> seed, StoreConfig config) {
        ItemMapper<T> mapper = ItemMapper.of(type);
        return create(mapper, ItemIdentity.property(mapper, config.idProperty()), seed, config);
    }

    /**
     * Store with an explicit mapper and id accessor, for items whose id is not a plain property.
     *
     * @param mapper item mapper
     * @param identity id accessor
     * @param seed initial items
     * @param config configuration
     * @param <T> item type
     * @return new root store
     * @throws IllegalArgumentException if an argument is null
     */
    public static <T> RootStore<T> create(ItemMapper<T> mapper, ItemIdentity<T> identity, List<T> seed, StoreConfig config) {
        return new RootStore<>(storageFactory(mapper, identity, config), seed, config, ViewFactory.defaultFactory());
    }

    /**
     * Factory of in-memory storages sharing one mapper, identity and configuration.
     *
     * @param mapper item mapper
     * @param identity id accessor
     * @param config configuration
     * @param <T> item type
     * @return storage factory
     */
    public static <T> StorageFactory<T> storageFactory(ItemMapper<T> mapper, ItemIdentity<T> identity, StoreConfig config) {
        return seed -> new InMemoryStorage<>(mapper, identity, config, seed);
    }
}
