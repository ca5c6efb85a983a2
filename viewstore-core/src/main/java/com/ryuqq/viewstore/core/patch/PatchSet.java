package com.ryuqq.viewstore.core.patch;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable {@code id -> Patch} request for partial updates.
 *
 * <p>Adding a second patch for an id that is already present merges the two
 * ({@code existing.merge(added)}), so submission order is preserved.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class PatchSet {

    private static final PatchSet EMPTY = new PatchSet(Map.of());

    private final Map<String, Patch> patches;

    private PatchSet(Map<String, Patch> patches) {
        this.patches = patches;
    }

    public static PatchSet empty() {
        return EMPTY;
    }

    /**
     * Set holding one patch.
     *
     * @param id item id
     * @param patch patch for that item
     * @return new set
     * @throws IllegalArgumentException if an argument is null
     */
    public static PatchSet of(String id, Patch patch) {
        return EMPTY.with(id, patch);
    }

    /**
     * Merges sets in order.
     *
     * @param sets sets, earliest first
     * @return one set whose per-id patches are merged in submission order
     */
    public static PatchSet mergeAll(List<PatchSet> sets) {
        PatchSet merged = EMPTY;
        for (PatchSet set : sets) {
            merged = merged.merge(set);
        }
        return merged;
    }

    /**
     * Copy with one more patch. A patch for an id already present is merged after it.
     *
     * @param id item id
     * @param patch patch for that item
     * @return new set
     * @throws IllegalArgumentException if an argument is null
     */
    public PatchSet with(String id, Patch patch) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (patch == null) {
            throw new IllegalArgumentException("patch cannot be null");
        }
        Map<String, Patch> copy = new LinkedHashMap<>(patches);
        copy.merge(id, patch, Patch::merge);
        return new PatchSet(Collections.unmodifiableMap(copy));
    }

    /**
     * Copy with every patch of a later set merged in.
     *
     * @param later set submitted after this one (null or empty returns this)
     * @return merged set
     */
    public PatchSet merge(PatchSet later) {
        if (later == null || later.isEmpty()) {
            return this;
        }
        Map<String, Patch> copy = new LinkedHashMap<>(patches);
        later.patches.forEach((id, patch) -> copy.merge(id, patch, Patch::merge));
        return new PatchSet(Collections.unmodifiableMap(copy));
    }

    public Patch get(String id) {
        return patches.get(id);
    }

    public Set<String> ids() {
        return patches.keySet();
    }

    /**
     * @return id to patch, unmodifiable, in first-submission order
     */
    public Map<String, Patch> asMap() {
        return patches;
    }

    public int size() {
        return patches.size();
    }

    public boolean isEmpty() {
        return patches.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof PatchSet && patches.equals(((PatchSet) o).patches);
    }

    @Override
    public int hashCode() {
        return patches.hashCode();
    }

    @Override
    public String toString() {
        return "PatchSet" + patches;
    }
}
