package com.ryuqq.viewstore.core.util;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;

/**
 * Helpers for Jackson trees: path parsing, value conversion, ordering and equality.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class JsonNodes {

    private static final ObjectMapper VALUE_MAPPER = new ObjectMapper();

    private JsonNodes() {
    }

    /**
     * Parses a property path.
     *
     * <p>Accepts a JSON pointer ({@code "/a/0/b"}), a dot path ({@code "a.0.b"}) or the empty
     * string for the document root.</p>
     *
     * @param path the path
     * @return compiled pointer
     * @throws IllegalArgumentException if path is null or not a valid pointer
     */
    public static JsonPointer pointer(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        if (path.isEmpty() || path.startsWith("/")) {
            return JsonPointer.compile(path);
        }
        StringBuilder sb = new StringBuilder();
        for (String segment : path.split("\\.", -1)) {
            sb.append('/').append(escape(segment));
        }
        return JsonPointer.compile(sb.toString());
    }

    /**
     * Pointer to a child property.
     *
     * @param parent parent pointer
     * @param property property name (escaped as needed)
     * @return child pointer
     */
    public static JsonPointer child(JsonPointer parent, String property) {
        return JsonPointer.compile(parent.toString() + "/" + escape(property));
    }

    /**
     * Pointer to an array element.
     *
     * @param parent parent pointer
     * @param index element index
     * @return child pointer
     */
    public static JsonPointer child(JsonPointer parent, int index) {
        return JsonPointer.compile(parent.toString() + "/" + index);
    }

    /**
     * Tree form of an operand value.
     *
     * @param value any Jackson-serializable value
     * @return the node ({@code NullNode} for null)
     */
    public static JsonNode valueOf(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (value instanceof JsonNode) {
            return (JsonNode) value;
        }
        return VALUE_MAPPER.valueToTree(value);
    }

    /**
     * Value at a path, never null.
     *
     * @param root document
     * @param pointer path
     * @return the node, or {@link MissingNode} when absent
     */
    public static JsonNode at(JsonNode root, JsonPointer pointer) {
        if (root == null) {
            return MissingNode.getInstance();
        }
        return root.at(pointer);
    }

    /**
     * @param node node, possibly null
     * @return whether the node is missing, null or JSON null
     */
    public static boolean isAbsent(JsonNode node) {
        return node == null || node.isMissingNode() || node.isNull();
    }

    /**
     * Total order over tree values used by property sorts and range comparisons.
     *
     * <p>Absent and null values sort before everything else. Numbers compare numerically,
     * text lexicographically, booleans false before true. Values of different kinds order by
     * kind, then by their JSON text.</p>
     *
     * @param a left value
     * @param b right value
     * @return negative, zero or positive
     */
    public static int compare(JsonNode a, JsonNode b) {
        boolean aAbsent = isAbsent(a);
        boolean bAbsent = isAbsent(b);
        if (aAbsent || bAbsent) {
            return aAbsent == bAbsent ? 0 : (aAbsent ? -1 : 1);
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        if (a.isTextual() && b.isTextual()) {
            return Integer.signum(a.textValue().compareTo(b.textValue()));
        }
        if (a.isBoolean() && b.isBoolean()) {
            return Boolean.compare(a.booleanValue(), b.booleanValue());
        }
        if (a.getNodeType() != b.getNodeType()) {
            return Integer.signum(a.getNodeType().compareTo(b.getNodeType()));
        }
        return Integer.signum(a.toString().compareTo(b.toString()));
    }

    /**
     * Structural equality with numeric normalization ({@code 1} equals {@code 1.0}).
     *
     * @param a left value
     * @param b right value
     * @return true if equal
     */
    public static boolean valueEquals(JsonNode a, JsonNode b) {
        if (isAbsent(a) || isAbsent(b)) {
            return isAbsent(a) && isAbsent(b);
        }
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    private static String escape(String segment) {
        return segment.replace("~", "~0").replace("/", "~1");
    }
}
