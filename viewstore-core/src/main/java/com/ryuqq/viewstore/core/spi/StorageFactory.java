package com.ryuqq.viewstore.core.spi;

import java.util.List;

/**
 * Creates storages for new roots, including the detached root a released view becomes.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StorageFactory<T> {

    /**
     * Builds a storage over seed data.
     *
     * @param seed initial items in order (ids must be unique)
     * @return new storage owning its own copy of the sequence
     * @throws com.ryuqq.viewstore.core.error.DuplicateIdException if two seed items share an id
     */
    Storage<T> create(List<T> seed);
}
