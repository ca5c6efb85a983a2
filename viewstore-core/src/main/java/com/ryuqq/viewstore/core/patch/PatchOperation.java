package com.ryuqq.viewstore.core.patch;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.viewstore.core.error.PatchApplicationException;

/**
 * One JSON-Pointer-addressed edit of a tree.
 *
 * <p>Semantics follow RFC 6902:</p>
 * <ul>
 *   <li>{@link Add}: sets an object member, or inserts into an array ({@code "-"} appends)</li>
 *   <li>{@link Replace}: overwrites an existing value</li>
 *   <li>{@link Remove}: deletes an existing value</li>
 * </ul>
 *
 * <p>An empty path addresses the whole document.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public sealed interface PatchOperation permits PatchOperation.Add, PatchOperation.Replace, PatchOperation.Remove {

    JsonPointer path();

    /**
     * RFC 6902 operation name.
     *
     * @return {@code "add"}, {@code "replace"} or {@code "remove"}
     */
    String op();

    /**
     * Applies this operation in place.
     *
     * @param document mutable document (already a private copy)
     * @return the resulting document (a different node only when the root is replaced)
     * @throws PatchApplicationException if the target or its parent does not exist
     */
    JsonNode applyTo(JsonNode document);

    /**
     * RFC 6902 form of this operation.
     *
     * @return {@code {"op":..,"path":..[,"value":..]}}
     */
    default ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("op", op());
        node.put("path", path().toString());
        if (this instanceof Add) {
            node.set("value", ((Add) this).value());
        } else if (this instanceof Replace) {
            node.set("value", ((Replace) this).value());
        }
        return node;
    }

    /**
     * True if {@code path} equals {@code ancestor} or lies beneath it.
     *
     * @param path candidate
     * @param ancestor covering path
     * @return coverage flag
     */
    static boolean covers(JsonPointer ancestor, JsonPointer path) {
        String a = ancestor.toString();
        String p = path.toString();
        return a.isEmpty() || p.equals(a) || p.startsWith(a + "/");
    }

    record Add(JsonPointer path, JsonNode value) implements PatchOperation {

        public Add {
            requirePath(path);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public String op() {
            return "add";
        }

        @Override
        public JsonNode applyTo(JsonNode document) {
            if (path.matches()) {
                return value.deepCopy();
            }
            JsonNode parent = parentOf(document, path);
            JsonPointer last = path.last();
            if (parent.isObject()) {
                ((ObjectNode) parent).set(last.getMatchingProperty(), value.deepCopy());
                return document;
            }
            ArrayNode array = (ArrayNode) parent;
            String segment = last.getMatchingProperty();
            if ("-".equals(segment)) {
                array.add(value.deepCopy());
                return document;
            }
            int index = last.getMatchingIndex();
            if (index < 0 || index > array.size()) {
                throw new PatchApplicationException("Array index out of bounds for add: " + path);
            }
            array.insert(index, value.deepCopy());
            return document;
        }

        /**
         * True if this add inserts into an array position rather than setting a member.
         *
         * @return positional flag
         */
        boolean isPositional() {
            if (path.matches()) {
                return false;
            }
            JsonPointer last = path.last();
            return "-".equals(last.getMatchingProperty()) || last.getMatchingIndex() >= 0;
        }
    }

    record Replace(JsonPointer path, JsonNode value) implements PatchOperation {

        public Replace {
            requirePath(path);
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public String op() {
            return "replace";
        }

        @Override
        public JsonNode applyTo(JsonNode document) {
            if (path.matches()) {
                return value.deepCopy();
            }
            JsonNode parent = parentOf(document, path);
            JsonPointer last = path.last();
            if (parent.isObject()) {
                String property = last.getMatchingProperty();
                if (!parent.has(property)) {
                    throw new PatchApplicationException("No value to replace at " + path);
                }
                ((ObjectNode) parent).set(property, value.deepCopy());
                return document;
            }
            ArrayNode array = (ArrayNode) parent;
            int index = last.getMatchingIndex();
            if (index < 0 || index >= array.size()) {
                throw new PatchApplicationException("No value to replace at " + path);
            }
            array.set(index, value.deepCopy());
            return document;
        }
    }

    record Remove(JsonPointer path) implements PatchOperation {

        public Remove {
            requirePath(path);
            if (path.matches()) {
                throw new IllegalArgumentException("cannot remove the document root");
            }
        }

        @Override
        public String op() {
            return "remove";
        }

        @Override
        public JsonNode applyTo(JsonNode document) {
            JsonNode parent = parentOf(document, path);
            JsonPointer last = path.last();
            if (parent.isObject()) {
                String property = last.getMatchingProperty();
                if (!parent.has(property)) {
                    throw new PatchApplicationException("No value to remove at " + path);
                }
                ((ObjectNode) parent).remove(property);
                return document;
            }
            ArrayNode array = (ArrayNode) parent;
            int index = last.getMatchingIndex();
            if (index < 0 || index >= array.size()) {
                throw new PatchApplicationException("No value to remove at " + path);
            }
            array.remove(index);
            return document;
        }
    }

    private static void requirePath(JsonPointer path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
    }

    private static JsonNode parentOf(JsonNode document, JsonPointer path) {
        JsonPointer head = path.head();
        JsonNode parent = head == null ? document : document.at(head);
        if (parent == null || !(parent.isObject() || parent.isArray())) {
            throw new PatchApplicationException("Missing container for path " + path);
        }
        return parent;
    }
}
