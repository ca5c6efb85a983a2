package com.ryuqq.viewstore.application.store;

import com.ryuqq.viewstore.application.transaction.Transaction;
import com.ryuqq.viewstore.core.model.IndexedData;
import com.ryuqq.viewstore.core.model.IndexedEntry;
import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Diff;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.query.Filter;
import com.ryuqq.viewstore.core.query.Queries;
import com.ryuqq.viewstore.core.query.Query;
import com.ryuqq.viewstore.core.query.Range;
import com.ryuqq.viewstore.core.query.Sort;
import com.ryuqq.viewstore.core.spi.Subscription;
import com.ryuqq.viewstore.core.update.BatchUpdate;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;
import com.ryuqq.viewstore.core.update.Update;
import com.ryuqq.viewstore.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

/**
 * Read layer over a root: the root's data passed through an ordered query pipeline.
 *
 * <p><strong>Materialization:</strong></p>
 * <ul>
 *   <li>Cold: {@link #fetch()} recomputes from the root when the cached version differs from
 *       the root's version, otherwise serves the cache</li>
 *   <li>Live ({@link #track()}): the view receives the root's events and maintains its own
 *       data and id map incrementally, staying in version lock-step with the root</li>
 * </ul>
 *
 * <p><strong>Incremental maintenance:</strong> filters are evaluated per event; insert
 * positions are found by binary search over (composed sort order, source position). Each
 * applied leaf event advances the view's version by one and is republished to the view's
 * subscribers with view-relative indices. A view with a {@link Range} step, a view that fell
 * out of lock-step, or an event without index information re-derives from the root instead and
 * publishes the difference.</p>
 *
 * <p>With copy-on-read enabled the cache holds the view's own copies of the root's items and
 * {@link #fetch()} hands out further copies, so callers never reach stored state.</p>
 *
 * <p>Mutations and {@code get} are forwarded verbatim to the root. After {@link #release()} the
 * view is backed by its own detached root and forwards everything there.</p>
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public class DerivedView<T> extends AbstractStore<T> {

    private static final Logger log = LoggerFactory.getLogger(DerivedView.class);

    private final Predicate<T> predicate;
    private final Comparator<T> order;
    private final boolean ranged;
    private final IndexedData<T> cache;
    private final Map<String, Integer> sourcePositions = new HashMap<>();

    private RootStore<T> source;
    private List<Query<T>> queries;
    private long version;
    private Subscription tracking;
    private boolean released;

    /**
     * Creates a cold view. Nothing is fetched until the first read or {@link #track()}.
     *
     * @param source root the view reads from
     * @param queries pipeline applied to the root's data, in order
     * @throws IllegalArgumentException if source or queries is null
     */
    public DerivedView(RootStore<T> source, List<Query<T>> queries) {
        super("DerivedView");
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (queries == null) {
            throw new IllegalArgumentException("queries cannot be null");
        }
        this.source = source;
        this.queries = List.copyOf(queries);
        this.predicate = Queries.predicate(this.queries);
        this.order = Queries.comparator(this.queries);
        this.ranged = Queries.hasRange(this.queries);
        ItemIdentity<T> identity = source.identity();
        this.cache = new IndexedData<>(identity::getId);
    }

    // ========================================
    // Reads
    // ========================================

    @Override
    public CompletableFuture<List<T>> get(List<String> ids) {
        return source.get(ids);
    }

    @Override
    public CompletableFuture<List<T>> fetch(List<Query<T>> extra) {
        if (extra == null) {
            throw new IllegalArgumentException("queries cannot be null");
        }
        if (released) {
            return source.fetch(extra);
        }
        return materialize().thenApply(data -> detachAll(extra.isEmpty() ? data : Queries.applyAll(extra, data)));
    }

    // ========================================
    // Mutations (forwarded)
    // ========================================

    @Override
    public CompletableFuture<List<T>> add(List<T> items) {
        return source.add(items);
    }

    @Override
    public CompletableFuture<List<T>> put(List<T> items) {
        return source.put(items);
    }

    @Override
    public CompletableFuture<List<T>> patch(PatchSet... patchSets) {
        return source.patch(patchSets);
    }

    @Override
    public CompletableFuture<List<String>> delete(String... ids) {
        return source.delete(ids);
    }

    @Override
    public Transaction<T> transaction() {
        return source.transaction();
    }

    // ========================================
    // Views
    // ========================================

    @Override
    public DerivedView<T> filter(Filter<T> filter) {
        return source.view(append(filter));
    }

    @Override
    public DerivedView<T> sort(Sort<T> sort) {
        return source.view(append(sort));
    }

    @Override
    public DerivedView<T> range(Range<T> range) {
        return source.view(append(range));
    }

    // ========================================
    // Lifecycle
    // ========================================

    @Override
    public CompletableFuture<Store<T>> track() {
        if (released || tracking != null) {
            return CompletableFuture.completedFuture(this);
        }
        tracking = source.registerTrackingView(this::onSourceUpdate);
        log.debug("View {} tracking root", queries);
        return refreshLive().<Store<T>>thenApply(ignored -> this);
    }

    @Override
    public CompletableFuture<List<T>> release() {
        if (released) {
            return source.release();
        }
        return fetch().thenApply(data -> {
            stopTracking();
            List<T> owned = source.mapper().copyAll(data);
            RootStore<T> detached = source.spawnRoot(owned, Math.max(version, 1L));
            detached.subscribe(propagator::publish);
            log.debug("View {} released with {} item(s) at version {}", queries, owned.size(), version);
            source = detached;
            queries = List.of();
            released = true;
            cache.reset(List.of());
            sourcePositions.clear();
            return data;
        });
    }

    // ========================================
    // Accessors
    // ========================================

    @Override
    public long version() {
        return released ? source.version() : version;
    }

    @Override
    public boolean isLive() {
        return tracking != null;
    }

    /**
     * Whether {@link #release()} has detached this view from its root.
     *
     * @return released flag
     */
    public boolean isReleased() {
        return released;
    }

    @Override
    public List<Query<T>> queries() {
        return queries;
    }

    @Override
    public String generateId() {
        return source.generateId();
    }

    @Override
    protected ItemIdentity<T> identity() {
        return source.identity();
    }

    @Override
    protected ItemMapper<T> mapper() {
        return source.mapper();
    }

    // ========================================
    // Materialization
    // ========================================

    private CompletableFuture<List<T>> materialize() {
        long target = source.version();
        if (version == target) {
            return CompletableFuture.completedFuture(cache.snapshot());
        }
        log.debug("View {} stale (version {}, root {}), recomputing", queries, version, target);
        CompletableFuture<Void> refresh = isLive() ? refreshLive() : refreshCold();
        return refresh.thenApply(ignored -> cache.snapshot());
    }

    private CompletableFuture<Void> refreshCold() {
        long target = source.version();
        return source.fetch(queries).thenAccept(data -> {
            cache.reset(data);
            version = target;
        });
    }

    /**
     * Re-derives from the root's whole sequence so source positions are known.
     */
    private CompletableFuture<Void> refreshLive() {
        long target = source.version();
        return source.fetch().thenAccept(all -> {
            ItemIdentity<T> identity = identity();
            Map<String, Integer> positions = new HashMap<>();
            for (int i = 0; i < all.size(); i++) {
                positions.put(identity.getId(all.get(i)), i);
            }
            cache.reset(Queries.applyAll(queries, all));
            sourcePositions.clear();
            for (int i = 0; i < cache.size(); i++) {
                String id = cache.idAt(i);
                sourcePositions.put(id, positions.get(id));
            }
            version = target;
        });
    }

    // ========================================
    // Live tracking
    // ========================================

    private void onSourceUpdate(List<Update<T>> updates) {
        if (released || tracking == null) {
            return;
        }
        int leaves = Update.leafCount(updates);
        long target = source.version();
        if (ranged || version + leaves != target || !hasIndices(updates)) {
            log.debug("View {} not in lock-step (version {} + {} events, root {}), re-deriving",
                queries, version, leaves, target);
            rederive(updates);
            return;
        }
        List<Update<T>> translated = new ArrayList<>(updates.size());
        for (Update<T> update : updates) {
            if (update instanceof BatchUpdate) {
                List<Update<T>> inner = new ArrayList<>();
                for (Update<T> leaf : update.leaves()) {
                    translate(leaf, inner);
                }
                if (!inner.isEmpty()) {
                    translated.add(new BatchUpdate<>(inner));
                }
            } else {
                translate(update, translated);
            }
        }
        version = target;
        propagator.publish(translated);
    }

    private void translate(Update<T> leaf, List<Update<T>> out) {
        if (leaf instanceof ItemAdded) {
            ItemAdded<T> added = (ItemAdded<T>) leaf;
            shiftPositions(added.index(), 1);
            if (predicate.test(added.item())) {
                T item = detach(added.item());
                int at = insert(added.id(), item, added.index());
                out.add(new ItemAdded<>(added.id(), item, at));
            }
        } else if (leaf instanceof ItemDeleted) {
            ItemDeleted<T> deleted = (ItemDeleted<T>) leaf;
            if (cache.contains(deleted.id())) {
                out.add(deleted.withIndex(evict(deleted.id())));
            }
            shiftPositions(deleted.index() + 1, -1);
        } else if (leaf instanceof ItemUpdated) {
            ItemUpdated<T> updated = (ItemUpdated<T>) leaf;
            String id = updated.id();
            int previous = cache.contains(id) ? evict(id) : Update.NO_INDEX;
            if (updated.previousIndex() != updated.index()) {
                shiftPositions(updated.previousIndex() + 1, -1);
                shiftPositions(updated.index(), 1);
            }
            if (predicate.test(updated.item())) {
                T item = detach(updated.item());
                int at = insert(id, item, updated.index());
                out.add(previous == Update.NO_INDEX
                    ? new ItemAdded<>(id, item, at)
                    : updated.relocate(item, previous, at));
            } else if (previous != Update.NO_INDEX) {
                out.add(new ItemDeleted<>(id, previous));
            }
        }
    }

    private int insert(String id, T item, int sourcePosition) {
        int low = 0;
        int high = cache.size();
        while (low < high) {
            int mid = (low + high) >>> 1;
            if (compare(cache.get(mid), sourcePositions.get(cache.idAt(mid)), item, sourcePosition) < 0) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        cache.insert(low, item);
        sourcePositions.put(id, sourcePosition);
        return low;
    }

    private T detach(T item) {
        return source.copiesOnRead() ? mapper().copy(item) : item;
    }

    private List<T> detachAll(List<T> items) {
        return source.copiesOnRead() ? mapper().copyAll(items) : items;
    }

    private int evict(String id) {
        sourcePositions.remove(id);
        return cache.remove(id);
    }

    private int compare(T a, int positionA, T b, int positionB) {
        if (order != null) {
            int byOrder = order.compare(a, b);
            if (byOrder != 0) {
                return byOrder;
            }
        }
        return Integer.compare(positionA, positionB);
    }

    private void shiftPositions(int from, int delta) {
        sourcePositions.replaceAll((id, position) -> position >= from ? position + delta : position);
    }

    private void rederive(List<Update<T>> updates) {
        Map<String, IndexedEntry<T>> before = entries();
        boolean batched = updates.size() == 1 && updates.get(0) instanceof BatchUpdate;
        refreshLive().whenComplete((ignored, error) -> {
            if (error != null) {
                version = 0L;
                log.error("View {} failed to re-derive after {} event(s)", queries, updates.size(), Futures.unwrap(error));
                return;
            }
            List<Update<T>> changes = changesSince(before);
            if (!changes.isEmpty()) {
                propagator.publish(batched ? List.<Update<T>>of(new BatchUpdate<>(changes)) : changes);
            }
        });
    }

    private Map<String, IndexedEntry<T>> entries() {
        Map<String, IndexedEntry<T>> entries = new LinkedHashMap<>();
        for (int i = 0; i < cache.size(); i++) {
            entries.put(cache.idAt(i), new IndexedEntry<>(cache.get(i), i));
        }
        return entries;
    }

    private List<Update<T>> changesSince(Map<String, IndexedEntry<T>> before) {
        List<Update<T>> changes = new ArrayList<>();
        List<Map.Entry<String, IndexedEntry<T>>> gone = new ArrayList<>();
        for (Map.Entry<String, IndexedEntry<T>> entry : before.entrySet()) {
            if (!cache.contains(entry.getKey())) {
                gone.add(entry);
            }
        }
        // highest index first so each removal index is still valid when replayed in order
        gone.sort((a, b) -> Integer.compare(b.getValue().index(), a.getValue().index()));
        for (Map.Entry<String, IndexedEntry<T>> entry : gone) {
            changes.add(new ItemDeleted<>(entry.getKey(), entry.getValue().index()));
        }
        ItemMapper<T> mapper = mapper();
        for (int i = 0; i < cache.size(); i++) {
            String id = cache.idAt(i);
            T item = cache.get(i);
            IndexedEntry<T> old = before.get(id);
            if (old == null) {
                changes.add(new ItemAdded<>(id, item, i));
            } else if (old.index() != i || !sameItem(old.item(), item)) {
                T previous = old.item();
                changes.add(new ItemUpdated<>(id, item, old.index(), i, () -> Diff.between(previous, item, mapper)));
            }
        }
        return changes;
    }

    private boolean sameItem(T a, T b) {
        return Objects.equals(a, b) || mapper().toTree(a).equals(mapper().toTree(b));
    }

    private static <T> boolean hasIndices(List<Update<T>> updates) {
        for (Update<T> update : updates) {
            for (Update<T> leaf : update.leaves()) {
                if (leaf instanceof ItemAdded && ((ItemAdded<T>) leaf).index() < 0) {
                    return false;
                }
                if (leaf instanceof ItemDeleted && ((ItemDeleted<T>) leaf).index() < 0) {
                    return false;
                }
                if (leaf instanceof ItemUpdated
                    && (((ItemUpdated<T>) leaf).index() < 0 || ((ItemUpdated<T>) leaf).previousIndex() < 0)) {
                    return false;
                }
            }
        }
        return true;
    }

    private void stopTracking() {
        if (tracking != null) {
            tracking.close();
            tracking = null;
        }
    }

    private List<Query<T>> append(Query<T> query) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        List<Query<T>> combined = new ArrayList<>(queries);
        combined.add(query);
        return combined;
    }
}
