package com.ryuqq.viewstore.core.update;

import com.ryuqq.viewstore.core.patch.Patch;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * An item was replaced or patched.
 *
 * <p>The structural diff is computed on first access only and then memoized, so subscribers
 * that ignore it never pay for it. For patch requests the submitted patch is the diff.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class ItemUpdated<T> implements Update<T> {

    private final String id;
    private final T item;
    private final int previousIndex;
    private final int index;
    private final Supplier<Patch> diffSupplier;
    private volatile Patch diff;

    /**
     * @param id item id
     * @param item item after the change
     * @param previousIndex position before the change
     * @param index position after the change
     * @param diffSupplier computes the diff on first access
     * @throws IllegalArgumentException if id or diffSupplier is null
     */
    public ItemUpdated(String id, T item, int previousIndex, int index, Supplier<Patch> diffSupplier) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (diffSupplier == null) {
            throw new IllegalArgumentException("diffSupplier cannot be null");
        }
        this.id = id;
        this.item = item;
        this.previousIndex = previousIndex;
        this.index = index;
        this.diffSupplier = diffSupplier;
    }

    /**
     * Update whose diff is a patch known up front.
     *
     * @param id item id
     * @param item item after the change
     * @param previousIndex position before the change
     * @param index position after the change
     * @param patch the diff
     * @param <T> item type
     * @return update event
     */
    public static <T> ItemUpdated<T> withPatch(String id, T item, int previousIndex, int index, Patch patch) {
        return new ItemUpdated<>(id, item, previousIndex, index, () -> patch);
    }

    public String id() {
        return id;
    }

    public T item() {
        return item;
    }

    public int previousIndex() {
        return previousIndex;
    }

    public int index() {
        return index;
    }

    /**
     * Structural diff between the previous and the new item.
     *
     * @return the diff (computed once)
     */
    public Patch diff() {
        Patch result = diff;
        if (result == null) {
            synchronized (this) {
                result = diff;
                if (result == null) {
                    result = diffSupplier.get();
                    diff = result;
                }
            }
        }
        return result;
    }

    /**
     * Same change re-expressed at other positions, carrying another instance of the item.
     * Shares the memoized diff.
     *
     * @param newItem item instance the relocated event carries (usually a copy of {@link #item()})
     * @param newPreviousIndex position before the change
     * @param newIndex position after the change
     * @return relocated event
     */
    public ItemUpdated<T> relocate(T newItem, int newPreviousIndex, int newIndex) {
        return new ItemUpdated<>(id, newItem, newPreviousIndex, newIndex, this::diff);
    }

    @Override
    public UpdateType type() {
        return UpdateType.UPDATED;
    }

    @Override
    public List<Update<T>> leaves() {
        return List.of(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ItemUpdated)) {
            return false;
        }
        ItemUpdated<?> that = (ItemUpdated<?>) o;
        return previousIndex == that.previousIndex
            && index == that.index
            && id.equals(that.id)
            && Objects.equals(item, that.item);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, item, previousIndex, index);
    }

    @Override
    public String toString() {
        return "ItemUpdated[id=" + id + ", item=" + item + ", previousIndex=" + previousIndex
            + ", index=" + index + "]";
    }
}
