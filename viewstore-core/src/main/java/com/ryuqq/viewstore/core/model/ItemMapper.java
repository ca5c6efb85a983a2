package com.ryuqq.viewstore.core.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.viewstore.core.error.ItemMappingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts items to and from their Jackson tree form.
 *
 * <p>The tree form is what patches, diffs, property filters and property sorts operate on,
 * so the structural subset they support is whatever Jackson can round-trip: records, beans,
 * maps, lists and primitives.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class ItemMapper<T> {

    private static final ObjectMapper DEFAULT_OBJECT_MAPPER = new ObjectMapper()
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ObjectMapper objectMapper;
    private final JavaType type;

    private ItemMapper(ObjectMapper objectMapper, JavaType type) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        this.objectMapper = objectMapper;
        this.type = type;
    }

    /**
     * Mapper over a shared {@link ObjectMapper} that ignores unknown properties.
     *
     * @param type item class
     * @param <T> item type
     * @return mapper
     */
    public static <T> ItemMapper<T> of(Class<T> type) {
        return of(DEFAULT_OBJECT_MAPPER, type);
    }

    /**
     * Mapper over a caller-configured {@link ObjectMapper}.
     *
     * @param objectMapper Jackson mapper
     * @param type item class
     * @param <T> item type
     * @return mapper
     * @throws IllegalArgumentException if an argument is null
     */
    public static <T> ItemMapper<T> of(ObjectMapper objectMapper, Class<T> type) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        return new ItemMapper<>(objectMapper, objectMapper.constructType(type));
    }

    public static <T> ItemMapper<T> of(ObjectMapper objectMapper, TypeReference<T> type) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        return new ItemMapper<>(objectMapper, objectMapper.constructType(type));
    }

    /**
     * Tree form of an item.
     *
     * @param item the item
     * @return a fresh tree (mutating it never affects the item)
     * @throws ItemMappingException if Jackson cannot serialize the item
     */
    public JsonNode toTree(T item) {
        return toNode(item);
    }

    /**
     * Item built from a tree.
     *
     * @param tree the tree form
     * @return the item
     * @throws ItemMappingException if the tree does not fit the item type
     */
    public T fromTree(JsonNode tree) {
        try {
            return objectMapper.treeToValue(tree, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ItemMappingException("Cannot convert tree to " + type.toCanonical(), e);
        }
    }

    /**
     * Tree form of an arbitrary value, used for filter operands.
     *
     * @param value any Jackson-serializable value (null allowed)
     * @return the tree form
     */
    public JsonNode toNode(Object value) {
        try {
            return objectMapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ItemMappingException("Cannot convert value to tree: " + value, e);
        }
    }

    /**
     * Deep copy through the tree form.
     *
     * @param item the item
     * @return a structurally equal item sharing no mutable state with the input
     */
    public T copy(T item) {
        if (item == null) {
            return null;
        }
        return fromTree(toTree(item));
    }

    /**
     * Deep copies of every item, in order.
     *
     * @param items the items
     * @return new list of copies
     */
    public List<T> copyAll(List<T> items) {
        List<T> copies = new ArrayList<>(items.size());
        for (T item : items) {
            copies.add(copy(item));
        }
        return copies;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }
}
