package com.ryuqq.viewstore.core.model;

import com.ryuqq.viewstore.core.error.DuplicateIdException;
import com.ryuqq.viewstore.core.error.ItemNotFoundException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Ordered item sequence plus its {@link IdMap}, kept in lock-step.
 *
 * <p><strong>Invariant:</strong> for every id in the map,
 * {@code data.get(map.get(id).index()) == map.get(id).item()}. Every mutator re-indexes the
 * entries that follow the touched position before returning.</p>
 *
 * <p>Not thread-safe: owned by exactly one store (a root storage or a derived view cache).</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class IndexedData<T> {

    private final Function<T, String> idOf;
    private final List<T> data;
    private final List<String> ids;
    private final IdMap<T> map;

    /**
     * Creates empty content.
     *
     * @param idOf id extractor; must return a non-null id for every stored item
     * @throws IllegalArgumentException if idOf is null
     */
    public IndexedData(Function<T, String> idOf) {
        if (idOf == null) {
            throw new IllegalArgumentException("idOf cannot be null");
        }
        this.idOf = idOf;
        this.data = new ArrayList<>();
        this.ids = new ArrayList<>();
        this.map = new IdMap<>();
    }

    /**
     * Replaces the whole content and rebuilds the map.
     *
     * @param items new ordered content
     * @throws DuplicateIdException if two items share an id (content is left empty)
     */
    public void reset(List<T> items) {
        data.clear();
        ids.clear();
        map.clear();
        for (T item : items) {
            String id = requireId(item);
            if (map.contains(id)) {
                data.clear();
                ids.clear();
                map.clear();
                throw new DuplicateIdException(id);
            }
            map.put(id, new IndexedEntry<>(item, data.size()));
            data.add(item);
            ids.add(id);
        }
    }

    /**
     * Appends an item.
     *
     * @param item the item
     * @return its index
     * @throws DuplicateIdException if the id is already present
     */
    public int append(T item) {
        return insert(data.size(), item);
    }

    /**
     * Inserts an item, shifting followers one position up.
     *
     * @param index target position (0..size)
     * @param item the item
     * @return the index
     * @throws DuplicateIdException if the id is already present
     */
    public int insert(int index, T item) {
        if (index < 0 || index > data.size()) {
            throw new IllegalArgumentException("index out of range: " + index + " (size " + data.size() + ")");
        }
        String id = requireId(item);
        if (map.contains(id)) {
            throw new DuplicateIdException(id);
        }
        data.add(index, item);
        ids.add(index, id);
        map.put(id, new IndexedEntry<>(item, index));
        reindexFrom(index + 1);
        return index;
    }

    /**
     * Replaces the item stored under an id, keeping its position.
     *
     * @param id the id
     * @param item the new item
     * @return the position
     * @throws ItemNotFoundException if the id is absent
     */
    public int replace(String id, T item) {
        IndexedEntry<T> entry = map.get(id);
        if (entry == null) {
            throw new ItemNotFoundException(id);
        }
        data.set(entry.index(), item);
        map.put(id, new IndexedEntry<>(item, entry.index()));
        return entry.index();
    }

    /**
     * Removes an id, shifting followers one position down.
     *
     * @param id the id
     * @return the position the item occupied
     * @throws ItemNotFoundException if the id is absent
     */
    public int remove(String id) {
        IndexedEntry<T> entry = map.remove(id);
        if (entry == null) {
            throw new ItemNotFoundException(id);
        }
        data.remove(entry.index());
        ids.remove(entry.index());
        reindexFrom(entry.index());
        return entry.index();
    }

    public boolean contains(String id) {
        return map.contains(id);
    }

    /**
     * Item and position of an id.
     *
     * @param id the id
     * @return the entry, or null if absent
     */
    public IndexedEntry<T> entry(String id) {
        return map.get(id);
    }

    public int indexOf(String id) {
        return map.indexOf(id);
    }

    public T get(int index) {
        return data.get(index);
    }

    /**
     * Id of the item at a position, without re-extracting it.
     *
     * @param index position
     * @return the id
     */
    public String idAt(int index) {
        return ids.get(index);
    }

    public int size() {
        return data.size();
    }

    /**
     * Immutable copy of the current order.
     *
     * @return snapshot list
     */
    public List<T> snapshot() {
        return List.copyOf(data);
    }

    /**
     * Checks the map/data invariant.
     *
     * @return true if every entry points at its item and sizes agree
     */
    public boolean isConsistent() {
        if (map.size() != data.size()) {
            return false;
        }
        for (int i = 0; i < data.size(); i++) {
            IndexedEntry<T> entry = map.get(ids.get(i));
            if (entry == null || entry.index() != i || entry.item() != data.get(i)) {
                return false;
            }
        }
        return true;
    }

    private void reindexFrom(int from) {
        for (int i = from; i < data.size(); i++) {
            map.put(ids.get(i), new IndexedEntry<>(data.get(i), i));
        }
    }

    private String requireId(T item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        String id = idOf.apply(item);
        if (id == null) {
            throw new IllegalArgumentException("item has no id: " + item);
        }
        return id;
    }
}
