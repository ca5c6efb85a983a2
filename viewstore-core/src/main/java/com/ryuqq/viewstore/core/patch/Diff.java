package com.ryuqq.viewstore.core.patch;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.util.JsonNodes;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Structural diff of two trees.
 *
 * <p>{@code Diff.between(a, b).apply(a)} equals {@code b} for every pair of trees. Objects are
 * compared member by member (removals, then changed members, then additions, each in the
 * member order of the respective tree). Arrays are compared position by position; trailing
 * removals are emitted from the highest index down so earlier ones stay valid. Anything else
 * that differs, including a change of node type, becomes a single {@code replace}.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class Diff {

    private Diff() {
    }

    /**
     * Patch turning one tree into the other.
     *
     * <p>Objects are compared key by key and arrays index by index; anything else that differs is
     * replaced. Equal trees give an empty patch.</p>
     *
     * @param before old tree
     * @param after new tree
     * @return patch with {@code patch.apply(before).equals(after)}
     * @throws IllegalArgumentException if a tree is null
     */
    public static Patch between(JsonNode before, JsonNode after) {
        if (before == null || after == null) {
            throw new IllegalArgumentException("trees cannot be null");
        }
        List<PatchOperation> operations = new ArrayList<>();
        diff(JsonPointer.empty(), before, after, operations);
        return Patch.of(operations);
    }

    /**
     * Patch between the tree forms of two items.
     *
     * @param before old item
     * @param after new item
     * @param mapper item mapper
     * @param <T> item type
     * @return structural diff
     */
    public static <T> Patch between(T before, T after, ItemMapper<T> mapper) {
        return between(mapper.toTree(before), mapper.toTree(after));
    }

    private static void diff(JsonPointer path, JsonNode before, JsonNode after, List<PatchOperation> out) {
        if (before.equals(after)) {
            return;
        }
        if (before.isObject() && after.isObject()) {
            diffObjects(path, before, after, out);
        } else if (before.isArray() && after.isArray()) {
            diffArrays(path, before, after, out);
        } else {
            out.add(new PatchOperation.Replace(path, after.deepCopy()));
        }
    }

    private static void diffObjects(JsonPointer path, JsonNode before, JsonNode after, List<PatchOperation> out) {
        Iterator<String> names = before.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!after.has(name)) {
                out.add(new PatchOperation.Remove(JsonNodes.child(path, name)));
            }
        }
        names = before.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (after.has(name)) {
                diff(JsonNodes.child(path, name), before.get(name), after.get(name), out);
            }
        }
        names = after.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (!before.has(name)) {
                out.add(new PatchOperation.Add(JsonNodes.child(path, name), after.get(name).deepCopy()));
            }
        }
    }

    private static void diffArrays(JsonPointer path, JsonNode before, JsonNode after, List<PatchOperation> out) {
        int common = Math.min(before.size(), after.size());
        for (int i = 0; i < common; i++) {
            diff(JsonNodes.child(path, i), before.get(i), after.get(i), out);
        }
        for (int i = before.size() - 1; i >= common; i--) {
            out.add(new PatchOperation.Remove(JsonNodes.child(path, i)));
        }
        for (int i = common; i < after.size(); i++) {
            out.add(new PatchOperation.Add(JsonNodes.child(path, i), after.get(i).deepCopy()));
        }
    }
}
