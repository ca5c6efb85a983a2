package com.ryuqq.viewstore.core.patch;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.ryuqq.viewstore.core.error.PatchApplicationException;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.util.JsonNodes;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered list of {@link PatchOperation}s over an item's tree form.
 *
 * <p>Immutable. {@link #apply(JsonNode)} never mutates its input.</p>
 *
 * <p><strong>Merge rule:</strong> {@code a.merge(b)} drops the operations of {@code a} that
 * {@code b} fully overwrites (an add-member or replace in {@code b} at the same path or an
 * ancestor path) and appends {@code b}'s operations. Array insertions and removals never
 * supersede anything, since they shift positions instead of overwriting them.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * Patch patch = Patch.builder()
 *     .replace("v", 9)
 *     .remove("/tags/0")
 *     .build();
 * JsonNode updated = patch.apply(tree);
 * </pre>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class Patch {

    private static final Patch EMPTY = new Patch(List.of());

    private final List<PatchOperation> operations;

    private Patch(List<PatchOperation> operations) {
        this.operations = operations;
    }

    /**
     * @return the patch with no operations
     */
    public static Patch empty() {
        return EMPTY;
    }

    /**
     * Patch running the operations in order.
     *
     * @param operations operations
     * @return patch
     * @throws IllegalArgumentException if operations is null
     */
    public static Patch of(List<PatchOperation> operations) {
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        return operations.isEmpty() ? EMPTY : new Patch(List.copyOf(operations));
    }

    public static Patch of(PatchOperation... operations) {
        return of(List.of(operations));
    }

    /**
     * @return builder of a new patch
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parses an RFC 6902 document.
     *
     * @param json array of operation objects
     * @return the patch
     * @throws PatchApplicationException if an element is malformed or uses an unsupported op
     */
    public static Patch fromJson(JsonNode json) {
        if (json == null || !json.isArray()) {
            throw new PatchApplicationException("JSON patch must be an array");
        }
        List<PatchOperation> parsed = new ArrayList<>(json.size());
        for (JsonNode element : json) {
            JsonNode op = element.get("op");
            JsonNode path = element.get("path");
            if (op == null || path == null || !path.isTextual()) {
                throw new PatchApplicationException("Malformed patch operation: " + element);
            }
            JsonPointer pointer = JsonPointer.compile(path.textValue());
            switch (op.asText()) {
                case "add":
                    parsed.add(new PatchOperation.Add(pointer, requireValue(element)));
                    break;
                case "replace":
                    parsed.add(new PatchOperation.Replace(pointer, requireValue(element)));
                    break;
                case "remove":
                    parsed.add(new PatchOperation.Remove(pointer));
                    break;
                default:
                    throw new PatchApplicationException("Unsupported patch operation: " + op.asText());
            }
        }
        return of(parsed);
    }

    public List<PatchOperation> operations() {
        return operations;
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    public int size() {
        return operations.size();
    }

    /**
     * Applies every operation in order to a private copy of the document.
     *
     * @param document input tree (left untouched)
     * @return patched tree
     * @throws PatchApplicationException if an operation targets a missing location
     */
    public JsonNode apply(JsonNode document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        JsonNode result = document.deepCopy();
        for (PatchOperation operation : operations) {
            result = operation.applyTo(result);
        }
        return result;
    }

    /**
     * Applies this patch to an item through its tree form.
     *
     * @param item the item
     * @param mapper item mapper
     * @param <T> item type
     * @return the patched item (a new instance)
     */
    public <T> T apply(T item, ItemMapper<T> mapper) {
        return mapper.fromTree(apply(mapper.toTree(item)));
    }

    /**
     * Patch equivalent to applying {@code this} and then {@code later}.
     *
     * @param later patch applied after this one
     * @return merged patch
     */
    public Patch merge(Patch later) {
        if (later == null || later.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return later;
        }
        List<PatchOperation> kept = new ArrayList<>(operations);
        List<PatchOperation> appended = new ArrayList<>(later.operations.size());
        for (PatchOperation next : later.operations) {
            if (!overwrites(next)) {
                appended.add(next);
                continue;
            }
            boolean droppedExact = dropCovered(kept, next.path()) | dropCovered(appended, next.path());
            if (droppedExact && next instanceof PatchOperation.Replace) {
                // the earlier op may have created the target; "add" sets it either way
                next = new PatchOperation.Add(next.path(), ((PatchOperation.Replace) next).value());
            }
            appended.add(next);
        }
        kept.addAll(appended);
        return of(kept);
    }

    /**
     * RFC 6902 array form.
     *
     * @return JSON array of operation objects
     */
    public ArrayNode toJson() {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (PatchOperation operation : operations) {
            array.add(operation.toJson());
        }
        return array;
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Patch)) {
            return false;
        }
        return operations.equals(((Patch) o).operations);
    }

    @Override
    public int hashCode() {
        return operations.hashCode();
    }

    /**
     * Removes the operations at or beneath {@code path}.
     *
     * @return true if one of them targeted exactly {@code path}
     */
    private static boolean dropCovered(List<PatchOperation> operations, JsonPointer path) {
        boolean exact = false;
        for (int i = operations.size() - 1; i >= 0; i--) {
            JsonPointer candidate = operations.get(i).path();
            if (PatchOperation.covers(path, candidate)) {
                exact |= candidate.toString().equals(path.toString());
                operations.remove(i);
            }
        }
        return exact;
    }

    private static boolean overwrites(PatchOperation operation) {
        if (operation instanceof PatchOperation.Replace) {
            return !isArrayIndex(operation.path());
        }
        if (operation instanceof PatchOperation.Add) {
            return !((PatchOperation.Add) operation).isPositional();
        }
        return false;
    }

    private static boolean isArrayIndex(JsonPointer path) {
        return !path.matches() && path.last().getMatchingIndex() >= 0;
    }

    private static JsonNode requireValue(JsonNode element) {
        JsonNode value = element.get("value");
        if (value == null) {
            throw new PatchApplicationException("Patch operation requires a value: " + element);
        }
        return value;
    }

    /**
     * Fluent patch construction. Paths accept dot or pointer syntax.
     */
    public static final class Builder {

        private final List<PatchOperation> operations = new ArrayList<>();

        private Builder() {
        }

        /**
         * Adds a property or inserts an array element.
         *
         * @param path target path
         * @param value value, converted to its tree form
         * @return this builder
         */
        public Builder add(String path, Object value) {
            operations.add(new PatchOperation.Add(JsonNodes.pointer(path), JsonNodes.valueOf(value)));
            return this;
        }

        /**
         * Replaces the value at an existing path.
         *
         * @param path target path
         * @param value value, converted to its tree form
         * @return this builder
         */
        public Builder replace(String path, Object value) {
            operations.add(new PatchOperation.Replace(JsonNodes.pointer(path), JsonNodes.valueOf(value)));
            return this;
        }

        /**
         * Removes the value at an existing path.
         *
         * @param path target path
         * @return this builder
         */
        public Builder remove(String path) {
            operations.add(new PatchOperation.Remove(JsonNodes.pointer(path)));
            return this;
        }

        public Builder operation(PatchOperation operation) {
            if (operation == null) {
                throw new IllegalArgumentException("operation cannot be null");
            }
            operations.add(operation);
            return this;
        }

        public Patch build() {
            return of(Collections.unmodifiableList(operations));
        }
    }
}
