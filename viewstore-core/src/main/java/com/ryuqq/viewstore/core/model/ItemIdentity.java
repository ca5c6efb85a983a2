package com.ryuqq.viewstore.core.model;

import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Extracts and assigns item ids.
 *
 * <p>Ids are assumed unique across a store hierarchy. {@code null} from {@link #getId(Object)}
 * means the item has no id yet.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public interface ItemIdentity<T> {

    /**
     * Id of an item.
     *
     * @param item the item
     * @return the id, or null when the item carries none
     */
    String getId(T item);

    /**
     * Copy of an item carrying the given id.
     *
     * @param item the item
     * @param id the id to assign
     * @return an item whose {@link #getId(Object)} is {@code id}
     */
    T withId(T item, String id);

    /**
     * Identity reading a top-level property through the tree form.
     *
     * @param mapper item mapper
     * @param property property name
     * @param <T> item type
     * @return property-based identity
     */
    static <T> ItemIdentity<T> property(ItemMapper<T> mapper, String property) {
        return new PropertyIdentity<>(mapper, property);
    }

    /**
     * Identity built from accessor functions.
     *
     * @param getter id getter
     * @param setter returns a copy of the item carrying the id
     * @param <T> item type
     * @return function-based identity
     */
    static <T> ItemIdentity<T> of(Function<T, String> getter, BiFunction<T, String, T> setter) {
        if (getter == null || setter == null) {
            throw new IllegalArgumentException("getter and setter cannot be null");
        }
        return new ItemIdentity<>() {
            @Override
            public String getId(T item) {
                return getter.apply(item);
            }

            @Override
            public T withId(T item, String id) {
                return setter.apply(item, id);
            }
        };
    }
}
