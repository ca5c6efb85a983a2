package com.ryuqq.viewstore.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * {@link ItemIdentity} backed by one top-level property of the item's tree form.
 *
 * <p>Non-textual id values are read with {@link JsonNode#asText()}, so numeric ids
 * become their decimal string.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
final class PropertyIdentity<T> implements ItemIdentity<T> {

    private final ItemMapper<T> mapper;
    private final String property;

    PropertyIdentity(ItemMapper<T> mapper, String property) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        if (property == null || property.isBlank()) {
            throw new IllegalArgumentException("property cannot be null or blank");
        }
        this.mapper = mapper;
        this.property = property;
    }

    @Override
    public String getId(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        JsonNode value = mapper.toTree(item).get(property);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        return value.asText();
    }

    @Override
    public T withId(T item, String id) {
        JsonNode tree = mapper.toTree(item);
        if (!(tree instanceof ObjectNode)) {
            throw new IllegalArgumentException("item is not an object and cannot carry property '" + property + "'");
        }
        ((ObjectNode) tree).put(property, id);
        return mapper.fromTree(tree);
    }
}
