package com.ryuqq.viewstore.testkit;

import com.fasterxml.jackson.databind.JsonNode;
import com.ryuqq.viewstore.application.store.DerivedView;
import com.ryuqq.viewstore.application.store.RootStore;
import com.ryuqq.viewstore.application.store.Store;
import com.ryuqq.viewstore.application.store.ViewFactory;
import com.ryuqq.viewstore.application.transaction.Transaction;
import com.ryuqq.viewstore.core.config.StoreConfig;
import com.ryuqq.viewstore.core.error.DuplicateIdException;
import com.ryuqq.viewstore.core.error.ItemNotFoundException;
import com.ryuqq.viewstore.core.error.NotSerializableQueryException;
import com.ryuqq.viewstore.core.error.TransactionFailedException;
import com.ryuqq.viewstore.core.model.ItemIdentity;
import com.ryuqq.viewstore.core.model.ItemMapper;
import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.query.Filter;
import com.ryuqq.viewstore.core.query.Range;
import com.ryuqq.viewstore.core.query.Sort;
import com.ryuqq.viewstore.core.spi.StorageFactory;
import com.ryuqq.viewstore.core.spi.Subscription;
import com.ryuqq.viewstore.core.update.BatchUpdate;
import com.ryuqq.viewstore.core.update.ItemAdded;
import com.ryuqq.viewstore.core.update.ItemDeleted;
import com.ryuqq.viewstore.core.update.ItemUpdated;
import com.ryuqq.viewstore.core.update.Update;
import com.ryuqq.viewstore.core.update.UpdateType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Abstract base class for Store Contract Tests.
 *
 * <p>Runs the store-level contract against whatever {@link StorageFactory} a subclass supplies.
 * Storages are wrapped in a {@link CountingStorage} so tests can tell cache hits from
 * recomputations.</p>
 *
 * <p><strong>Contract Coverage:</strong></p>
 * <ul>
 *   <li>Add/get/put/patch/delete semantics, id uniqueness and re-indexing</li>
 *   <li>Version advance per applied mutation, event shapes per call</li>
 *   <li>Query composition and view caching</li>
 *   <li>Live tracking, release, transactions and subscriber isolation</li>
 *   <li>Large batches and isolation of stored state from caller-held instances</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStorageContractTest extends AbstractStoreContractTest {
 *     {@literal @}Override
 *     protected &lt;T&gt; StorageFactory&lt;T&gt; storageFactory(ItemMapper&lt;T&gt; mapper,
 *                                                  ItemIdentity&lt;T&gt; identity,
 *                                                  StoreConfig config) {
 *         return seed -&gt; new MyStorage&lt;&gt;(mapper, identity, config, seed);
 *     }
 * }
 * </pre>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public abstract class AbstractStoreContractTest {

    private static final int LARGE_BATCH = 50_000;

    protected ItemMapper<TestItem> mapper;
    protected CountingStorage.Factory<TestItem> storages;
    protected RootStore<TestItem> store;

    /**
     * Storage factory under test.
     *
     * @param mapper item mapper
     * @param identity id accessor
     * @param config store configuration
     * @param <T> item type
     * @return factory building storages over seed data
     */
    protected abstract <T> StorageFactory<T> storageFactory(ItemMapper<T> mapper,
                                                         ItemIdentity<T> identity,
                                                         StoreConfig config);

    protected StoreConfig config() {
        return new StoreConfig();
    }

    @BeforeEach
    void setUpStore() {
        mapper = ItemMapper.of(TestItem.class);
        store = newStore(TestItem.of("1", 1), TestItem.of("2", 2));
    }

    /**
     * Creates a fresh root over seed items; {@link #storages} then tracks its storages.
     *
     * @param seed initial items
     * @return new root store
     */
    protected RootStore<TestItem> newStore(TestItem... seed) {
        StoreConfig config = config();
        storages = CountingStorage.factory(storageFactory(mapper, ItemIdentity.property(mapper, config.idProperty()), config));
        return new RootStore<>(storages, List.of(seed), config, ViewFactory.defaultFactory());
    }

    /**
     * Creates a root over mutable bean items, built by the same storage factory.
     *
     * @param seed initial items
     * @return new root store
     */
    protected RootStore<MutableItem> newMutableStore(MutableItem... seed) {
        StoreConfig config = config();
        ItemMapper<MutableItem> beanMapper = ItemMapper.of(MutableItem.class);
        StorageFactory<MutableItem> factory =
            storageFactory(beanMapper, ItemIdentity.property(beanMapper, config.idProperty()), config);
        return new RootStore<>(factory, List.of(seed), config, ViewFactory.defaultFactory());
    }

    protected CountingStorage<TestItem> rootStorage() {
        return storages.first();
    }

    protected Filter<TestItem> vGreaterThan(int bound) {
        return store.createFilter().greaterThan("v", bound);
    }

    protected static Patch setV(int value) {
        return Patch.builder().replace("v", value).build();
    }

    // ============================================================
    // Add / get
    // ============================================================

    @Test
    void testAdd_WhenIdIsNew_ItemIsRetrievableAtItsFetchPosition() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        TestItem item = new TestItem("3", 7, "seven");

        // When
        TestItem stored = store.add(item).join();

        // Then
        assertThat(stored).isEqualTo(item);
        assertThat(store.get("3").join()).containsExactly(item);
        List<TestItem> data = store.fetch().join();
        ItemAdded<TestItem> added = (ItemAdded<TestItem>) subscriber.lastCall().get(0);
        assertThat(added.index()).isEqualTo(2);
        assertThat(data.get(added.index())).isEqualTo(item);
    }

    @Test
    void testAdd_WhenItemHasNoId_IdIsGenerated() {
        // When
        TestItem stored = store.add(new TestItem(null, 4, "anon")).join();

        // Then
        assertThat(stored.id()).isNotBlank();
        assertThat(store.get(stored.id()).join()).containsExactly(stored);
    }

    @Test
    void testAdd_WhenIdAlreadyPresent_FailsWithDuplicateIdAndKeepsFirstItem() {
        // Given
        TestItem first = new TestItem("9", 1, "first");
        store.add(first).join();

        // When / Then
        assertThatThrownBy(() -> store.add(new TestItem("9", 2, "second")).join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(DuplicateIdException.class);
        assertThat(store.get("9").join()).containsExactly(first);
    }

    @Test
    void testAdd_WhenSeveralItems_VersionAdvancesPerItemInOneDelivery() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        long before = store.version();

        // When
        store.add(List.of(TestItem.of("3", 3), TestItem.of("4", 4))).join();

        // Then
        assertThat(store.version()).isEqualTo(before + 2);
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(subscriber.lastCall()).extracting(Update::type).containsExactly(UpdateType.ADDED, UpdateType.ADDED);
        assertThat(subscriber.lastCall()).extracting(update -> ((ItemAdded<TestItem>) update).index())
            .containsExactly(2, 3);
    }

    @Test
    void testGet_WhenIdAbsent_FailsWithNotFound() {
        assertThatThrownBy(() -> store.get("404").join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(ItemNotFoundException.class);
    }

    // ============================================================
    // Put / patch
    // ============================================================

    @Test
    void testPatch_WhenIdPresent_AppliesPatchAndEmitsReconstructingDiff() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        long before = store.version();

        // When
        store.patch("1", setV(9)).join();

        // Then
        assertThat(store.get("1").join()).containsExactly(TestItem.of("1", 9));
        assertThat(store.version()).isEqualTo(before + 1);
        assertThat(subscriber.lastCall()).hasSize(1);
        ItemUpdated<TestItem> updated = (ItemUpdated<TestItem>) subscriber.lastCall().get(0);
        assertThat(updated.id()).isEqualTo("1");
        JsonNode reconstructed = updated.diff().apply(mapper.toTree(TestItem.of("1", 1)));
        assertThat(reconstructed).isEqualTo(mapper.toTree(TestItem.of("1", 9)));
    }

    @Test
    void testPatch_WhenIdAbsent_FailsWithNotFound() {
        assertThatThrownBy(() -> store.patch("404", setV(1)).join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(ItemNotFoundException.class);
    }

    @Test
    void testPatch_WhenSameIdPatchedAcrossSets_PatchesMergeInSubmissionOrder() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        PatchSet first = PatchSet.of("1", setV(5));
        PatchSet second = PatchSet.of("1", setV(6)).with("2", Patch.builder().add("name", "two").build());

        // When
        List<TestItem> patched = store.patch(first, second).join();

        // Then
        assertThat(patched).containsExactly(TestItem.of("1", 6), new TestItem("2", 2, "two"));
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(subscriber.lastCall()).singleElement().isInstanceOf(BatchUpdate.class);
        assertThat(subscriber.leaves()).hasSize(2);
    }

    @Test
    void testPut_WhenItemReplaced_DiffTransformsOldIntoNew() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        TestItem replacement = new TestItem("2", 5, "five");

        // When
        store.put(replacement).join();

        // Then
        ItemUpdated<TestItem> updated = (ItemUpdated<TestItem>) subscriber.lastCall().get(0);
        assertThat(updated.previousIndex()).isEqualTo(1);
        assertThat(updated.index()).isEqualTo(1);
        assertThat(updated.diff().apply(mapper.toTree(TestItem.of("2", 2)))).isEqualTo(mapper.toTree(replacement));
    }

    @Test
    void testPut_WhenMixedAddsAndUpdates_DeliversOneBatch() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        long before = store.version();

        // When
        store.put(List.of(TestItem.of("1", 10), TestItem.of("5", 50))).join();

        // Then
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(subscriber.lastCall()).singleElement().isInstanceOf(BatchUpdate.class);
        assertThat(subscriber.leaves()).extracting(Update::type).containsExactly(UpdateType.UPDATED, UpdateType.ADDED);
        assertThat(store.version()).isEqualTo(before + 2);
        assertThat(store.fetch().join()).containsExactly(TestItem.of("1", 10), TestItem.of("2", 2), TestItem.of("5", 50));
    }

    // ============================================================
    // Delete
    // ============================================================

    @Test
    void testDelete_WhenItemRemoved_FollowersAreReindexed() {
        // Given
        store = newStore(TestItem.of("a", 1), TestItem.of("b", 2), TestItem.of("c", 3), TestItem.of("d", 4));
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);

        // When
        List<String> deleted = store.delete("b").join();

        // Then
        assertThat(deleted).containsExactly("b");
        assertThat(((ItemDeleted<TestItem>) subscriber.lastCall().get(0)).index()).isEqualTo(1);
        assertThat(store.fetch().join()).extracting(TestItem::id).containsExactly("a", "c", "d");

        // the id map follows the new positions
        store.put(TestItem.of("d", 40)).join();
        assertThat(((ItemUpdated<TestItem>) subscriber.lastCall().get(0)).index()).isEqualTo(2);
    }

    @Test
    void testDelete_WhenIdAbsent_FailsWithNotFound() {
        assertThatThrownBy(() -> store.delete("404").join())
            .isInstanceOf(CompletionException.class)
            .hasCauseInstanceOf(ItemNotFoundException.class);
    }

    // ============================================================
    // Transactions
    // ============================================================

    @Test
    void testTransaction_WhenMiddleRequestFails_EarlierEffectsRemainAndOneBatchPublished() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        Transaction<TestItem> transaction = store.transaction()
            .add(TestItem.of("x", 3))
            .patch("missing", setV(9))
            .delete("2");

        // When
        CompletionException thrown = assertThrows(CompletionException.class, () -> transaction.commit().join());

        // Then
        assertThat(thrown.getCause()).isInstanceOf(TransactionFailedException.class);
        TransactionFailedException failure = (TransactionFailedException) thrown.getCause();
        assertThat(failure.getFailedIndex()).isEqualTo(1);
        assertThat(failure.getCause()).isInstanceOf(ItemNotFoundException.class);
        assertThat(failure.getAppliedUpdates()).hasSize(1);

        assertThat(store.get("x").join()).containsExactly(TestItem.of("x", 3));
        assertThat(store.get("2").join()).containsExactly(TestItem.of("2", 2));
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(subscriber.lastCall()).singleElement().isInstanceOf(BatchUpdate.class);
        assertThat(subscriber.leaves()).extracting(Update::type).containsExactly(UpdateType.ADDED);
    }

    @Test
    void testTransaction_WhenCommitted_PublishesExactlyOneBatchAndCannotCommitAgain() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        Transaction<TestItem> transaction = store.transaction()
            .add(TestItem.of("3", 3))
            .put(TestItem.of("1", 11))
            .delete("2");

        // When
        BatchUpdate<TestItem> batch = transaction.commit().join();

        // Then
        assertThat(batch.updates()).extracting(Update::type)
            .containsExactly(UpdateType.ADDED, UpdateType.UPDATED, UpdateType.DELETED);
        assertThat(subscriber.calls()).containsExactly(List.of(batch));
        assertThat(store.fetch().join()).containsExactly(TestItem.of("1", 11), TestItem.of("3", 3));
        assertThatThrownBy(transaction::commit).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testTransaction_WhenTwoCommitted_BatchesArriveWhole() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        Transaction<TestItem> first = store.transaction().add(TestItem.of("3", 3)).add(TestItem.of("4", 4));
        Transaction<TestItem> second = store.transaction().delete("3").add(TestItem.of("5", 5));

        // When
        first.commit();
        second.commit().join();

        // Then
        assertThat(subscriber.callCount()).isEqualTo(2);
        assertThat(subscriber.calls()).allSatisfy(call -> assertThat(call).singleElement().isInstanceOf(BatchUpdate.class));
        assertThat(store.fetch().join()).extracting(TestItem::id).containsExactly("1", "2", "4", "5");
    }

    // ============================================================
    // Query composition and views
    // ============================================================

    @Test
    void testFetch_WhenFilterSortRangeChained_EqualsSequentialApplication() {
        // Given
        store = newStore(TestItem.of("a", 5), TestItem.of("b", 3), TestItem.of("c", 8),
            TestItem.of("d", 1), TestItem.of("e", 9), TestItem.of("f", 2));
        Filter<TestItem> filter = vGreaterThan(1);
        Sort<TestItem> sort = Sort.by(mapper, "v", true);
        Range<TestItem> range = Range.of(1, 3);
        List<TestItem> expected = range.apply(sort.apply(filter.apply(store.fetch().join())));

        // When
        Store<TestItem> filteredAndSorted = store.filter(filter).sort(sort);
        Store<TestItem> windowed = filteredAndSorted.range(range);

        // Then
        assertThat(windowed.fetch().join()).isEqualTo(expected);
        assertThat(windowed.fetch().join()).extracting(TestItem::id).containsExactly("c", "a", "b");
        assertThat(windowed.queries()).containsExactly(filter, sort, range);
        assertThat(store.fetch(List.of(filter, sort, range)).join()).isEqualTo(expected);
        assertThat(filteredAndSorted.fetch(List.of(range)).join()).isEqualTo(expected);
    }

    @Test
    void testView_WhenMutatedThroughView_RootIsAuthoritative() {
        // Given
        Store<TestItem> view = store.filter(vGreaterThan(1)).sort("v");

        // When
        view.add(TestItem.of("0", 0)).join();

        // Then
        assertThat(store.get("0").join()).containsExactly(TestItem.of("0", 0));
        int gets = rootStorage().getCount();
        assertThat(view.get("0").join()).containsExactly(TestItem.of("0", 0));
        assertThat(rootStorage().getCount()).isEqualTo(gets + 1);
        assertThat(view.fetch().join()).extracting(TestItem::id).containsExactly("2");
    }

    @Test
    void testFetch_WhenRootUnchanged_ViewServesCache() {
        // Given
        Store<TestItem> view = store.filter(vGreaterThan(1));
        view.fetch().join();
        int fetches = rootStorage().fetchCount();

        // When
        List<TestItem> cached = view.fetch().join();

        // Then
        assertThat(cached).containsExactly(TestItem.of("2", 2));
        assertThat(rootStorage().fetchCount()).isEqualTo(fetches);

        // a root mutation makes the view stale
        store.add(TestItem.of("3", 3)).join();
        assertThat(view.fetch().join()).containsExactly(TestItem.of("2", 2), TestItem.of("3", 3));
        assertThat(rootStorage().fetchCount()).isEqualTo(fetches + 1);
    }

    @Test
    void testQueryString_WhenStructured_SerializesAndWhenCustom_Refuses() {
        // Given
        Store<TestItem> structured = store.filter(store.createFilter().equalTo("v", 1)).sort("v", true).range(0, 5);
        Store<TestItem> custom = store.filter(item -> item.v() > 1);

        // Then
        assertThat(structured.queries()).extracting(query -> query.toQueryString())
            .containsExactly("eq(v,1)", "sort(-v)", "limit(5,0)");
        assertThatThrownBy(() -> custom.queries().get(0).toQueryString())
            .isInstanceOf(NotSerializableQueryException.class);
    }

    // ============================================================
    // Live tracking
    // ============================================================

    @Test
    void testTrack_WhenRootAddsMatchingItem_ViewUpdatesWithoutRefetch() {
        // Given
        Store<TestItem> view = store.filter(vGreaterThan(1)).track().join();
        int fetches = rootStorage().fetchCount();

        // When
        store.add(TestItem.of("3", 5)).join();

        // Then
        assertThat(view.isLive()).isTrue();
        assertThat(view.fetch().join()).containsExactly(TestItem.of("2", 2), TestItem.of("3", 5));
        assertThat(rootStorage().fetchCount()).isEqualTo(fetches);
        assertThat(view.version()).isEqualTo(store.version());
    }

    @Test
    void testTrack_WhenRootMutatesRepeatedly_ViewMatchesColdView() {
        // Given
        store = newStore(TestItem.of("a", 5), TestItem.of("b", 3), TestItem.of("c", 8));
        Filter<TestItem> filter = vGreaterThan(2);
        Store<TestItem> tracked = store.filter(filter).sort("v", true).track().join();
        int fetches = rootStorage().fetchCount();

        // When
        store.add(List.of(TestItem.of("d", 6), TestItem.of("e", 1), TestItem.of("f", 6))).join();
        store.put(TestItem.of("a", 10)).join();
        store.patch("b", setV(0)).join();
        store.patch("e", setV(7)).join();
        store.delete("c").join();
        store.transaction().add(TestItem.of("g", 6)).put(TestItem.of("f", 4)).delete("d").commit().join();

        // Then
        List<TestItem> cold = store.filter(filter).sort("v", true).fetch().join();
        assertThat(tracked.fetch().join()).isEqualTo(cold);
        assertThat(cold).extracting(TestItem::id).containsExactly("a", "e", "g", "f");
        assertThat(rootStorage().fetchCount()).isEqualTo(fetches + 1);
        assertThat(tracked.version()).isEqualTo(store.version());
    }

    @Test
    void testTrack_WhenItemsCrossFilterBoundary_ViewPublishesViewRelativeEvents() {
        // Given
        Store<TestItem> view = store.filter(vGreaterThan(1)).track().join();
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        view.subscribe(subscriber);

        // When
        store.add(TestItem.of("0", 0)).join();
        store.patch("2", setV(0)).join();
        store.patch("1", setV(7)).join();
        store.patch("1", setV(8)).join();

        // Then
        assertThat(subscriber.calls()).hasSize(3);
        assertThat(subscriber.leaves()).extracting(Update::type)
            .containsExactly(UpdateType.DELETED, UpdateType.ADDED, UpdateType.UPDATED);
        assertThat(((ItemDeleted<TestItem>) subscriber.leaves().get(0)).index()).isEqualTo(0);
        assertThat(((ItemAdded<TestItem>) subscriber.leaves().get(1)).index()).isEqualTo(0);
        assertThat(view.fetch().join()).containsExactly(TestItem.of("1", 8));
    }

    @Test
    void testTrack_WhenViewHasRange_ViewReDerivesAndStaysConsistent() {
        // Given
        store = newStore(TestItem.of("a", 5), TestItem.of("b", 3), TestItem.of("c", 8));
        Store<TestItem> smallest = store.sort("v").range(0, 2).track().join();
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        smallest.subscribe(subscriber);

        // When
        store.add(TestItem.of("d", 1)).join();

        // Then
        assertThat(smallest.fetch().join()).extracting(TestItem::id).containsExactly("d", "b");
        assertThat(subscriber.leaves()).extracting(Update::type).contains(UpdateType.ADDED, UpdateType.DELETED);
        assertThat(smallest.version()).isEqualTo(store.version());
    }

    @Test
    void testRelease_WhenViewReleased_BecomesIndependentRoot() {
        // Given
        DerivedView<TestItem> view = store.filter(vGreaterThan(1));
        view.track().join();

        // When
        List<TestItem> released = view.release().join();

        // Then
        assertThat(released).containsExactly(TestItem.of("2", 2));
        assertThat(view.isReleased()).isTrue();
        assertThat(view.isLive()).isFalse();
        assertThat(storages.created()).hasSize(2);
        assertThat(view.queries()).isEmpty();

        store.add(TestItem.of("3", 30)).join();
        assertThat(view.fetch().join()).containsExactly(TestItem.of("2", 2));

        view.add(TestItem.of("4", 0)).join();
        assertThat(view.fetch().join()).containsExactly(TestItem.of("2", 2), TestItem.of("4", 0));
        assertThatThrownBy(() -> store.get("4").join()).hasCauseInstanceOf(ItemNotFoundException.class);
    }

    // ============================================================
    // Large batches
    // ============================================================

    @Test
    void testAdd_WhenBatchIsLarge_EveryItemIsStoredAndDeliveredOnce() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        List<TestItem> items = new ArrayList<>(LARGE_BATCH);
        for (int i = 0; i < LARGE_BATCH; i++) {
            items.add(TestItem.of("b" + i, i));
        }

        // When
        List<TestItem> added = store.add(items).join();

        // Then
        assertThat(added).hasSize(LARGE_BATCH);
        assertThat(store.fetch().join()).hasSize(LARGE_BATCH + 2);
        assertThat(store.version()).isEqualTo(1L + LARGE_BATCH);
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(subscriber.leaves()).hasSize(LARGE_BATCH);
    }

    @Test
    void testTransaction_WhenLarge_CommitsEveryRequestAsOneBatch() {
        // Given
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        store.subscribe(subscriber);
        Transaction<TestItem> transaction = store.transaction();
        for (int i = 0; i < LARGE_BATCH; i++) {
            transaction.add(TestItem.of("t" + i, i));
        }

        // When
        BatchUpdate<TestItem> batch = transaction.commit().join();

        // Then
        assertThat(batch.updates()).hasSize(LARGE_BATCH);
        assertThat(store.fetch().join()).hasSize(LARGE_BATCH + 2);
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(subscriber.lastCall()).singleElement().isInstanceOf(BatchUpdate.class);
    }

    // ============================================================
    // Stored state isolation
    // ============================================================

    @Test
    void testAddAndPut_WhenCallerMutatesItsInstance_StoredItemIsUnchanged() {
        // Given
        RootStore<MutableItem> beans = newMutableStore(new MutableItem("1", 1));
        MutableItem added = new MutableItem("2", 2);
        MutableItem replacement = new MutableItem("1", 10);

        // When
        beans.add(added).join();
        beans.put(replacement).join();
        added.setId("zzz");
        added.setV(999);
        replacement.setV(999);

        // Then
        assertThat(beans.get("1", "2").join())
            .containsExactly(new MutableItem("1", 10), new MutableItem("2", 2));
    }

    @Test
    void testGetAndFetch_WhenResultsMutated_StoredItemIsUnchanged() {
        // Given
        RootStore<MutableItem> beans = newMutableStore(new MutableItem("1", 1), new MutableItem("2", 2));

        // When
        beans.get("1").join().get(0).setV(999);
        MutableItem fetched = beans.fetch().join().get(1);
        fetched.setId("zzz");
        fetched.setV(999);

        // Then
        assertThat(beans.get("1", "2").join())
            .containsExactly(new MutableItem("1", 1), new MutableItem("2", 2));
        assertThat(beans.fetch().join())
            .containsExactly(new MutableItem("1", 1), new MutableItem("2", 2));
    }

    @Test
    void testTrackedView_WhenFetchResultMutated_RootAndViewAreUnchanged() {
        // Given
        RootStore<MutableItem> beans = newMutableStore(new MutableItem("1", 1));
        Store<MutableItem> view = beans.filter(item -> true).track().join();
        beans.add(new MutableItem("2", 2)).join();

        // When
        MutableItem fetched = view.fetch().join().get(1);
        fetched.setId("zzz");
        fetched.setV(999);

        // Then
        assertThat(beans.get("2").join()).containsExactly(new MutableItem("2", 2));
        assertThat(view.fetch().join())
            .containsExactly(new MutableItem("1", 1), new MutableItem("2", 2));
        assertThatThrownBy(() -> beans.get("zzz").join()).hasCauseInstanceOf(ItemNotFoundException.class);
    }

    // ============================================================
    // Subscribers
    // ============================================================

    @Test
    void testSubscribe_WhenSubscriberThrows_OthersStillNotified() {
        // Given
        store.subscribe(updates -> {
            throw new IllegalStateException("boom");
        });
        RecordingSubscriber<TestItem> subscriber = new RecordingSubscriber<>();
        Subscription subscription = store.subscribe(subscriber);

        // When
        store.add(TestItem.of("3", 3)).join();
        subscription.close();
        store.add(TestItem.of("4", 4)).join();

        // Then
        assertThat(subscriber.callCount()).isEqualTo(1);
        assertThat(store.fetch().join()).hasSize(4);
    }
}
