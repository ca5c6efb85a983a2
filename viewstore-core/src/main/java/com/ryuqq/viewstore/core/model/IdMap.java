package com.ryuqq.viewstore.core.model;

import java.util.HashMap;
import java.util.Map;

/**
 * Id to {@link IndexedEntry} index over an ordered item sequence.
 *
 * <p>Only {@link IndexedData} mutates a map; it also rejects duplicate ids before an entry
 * reaches the map.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class IdMap<T> {

    private final Map<String, IndexedEntry<T>> entries;

    IdMap() {
        this.entries = new HashMap<>();
    }

    public IndexedEntry<T> get(String id) {
        return entries.get(id);
    }

    public boolean contains(String id) {
        return entries.containsKey(id);
    }

    /**
     * Position of an id.
     *
     * @param id the id
     * @return the index, or -1 if absent
     */
    public int indexOf(String id) {
        IndexedEntry<T> entry = entries.get(id);
        return entry == null ? -1 : entry.index();
    }

    public int size() {
        return entries.size();
    }

    void put(String id, IndexedEntry<T> entry) {
        entries.put(id, entry);
    }

    IndexedEntry<T> remove(String id) {
        return entries.remove(id);
    }

    void clear() {
        entries.clear();
    }
}
