package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.patch.PatchSet;
import com.ryuqq.viewstore.core.update.BatchUpdate;
import com.ryuqq.viewstore.core.update.Update;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Default {@link Transaction}: buffers requests, then runs them through the target's sequencer.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class SimpleTransaction<T> implements Transaction<T> {

    private static final Logger log = LoggerFactory.getLogger(SimpleTransaction.class);

    private final MutationTarget<T> target;
    private final List<MutationRequest<T>> requests = new ArrayList<>();
    private boolean committed;

    /**
     * Creates an empty transaction.
     *
     * @param target root the requests are applied to on commit
     * @throws IllegalArgumentException if target is null
     */
    public SimpleTransaction(MutationTarget<T> target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        this.target = target;
    }

    @Override
    public Transaction<T> add(T item) {
        return buffer(new MutationRequest.AddRequest<>(item));
    }

    @Override
    public Transaction<T> put(T item) {
        return buffer(new MutationRequest.PutRequest<>(item));
    }

    @Override
    public Transaction<T> patch(PatchSet patchSet) {
        if (patchSet == null) {
            throw new IllegalArgumentException("patchSet cannot be null");
        }
        for (Map.Entry<String, Patch> entry : patchSet.asMap().entrySet()) {
            buffer(new MutationRequest.PatchRequest<>(entry.getKey(), entry.getValue()));
        }
        return this;
    }

    @Override
    public Transaction<T> patch(String id, Patch patch) {
        return buffer(new MutationRequest.PatchRequest<>(id, patch));
    }

    @Override
    public Transaction<T> delete(String... ids) {
        for (String id : ids) {
            buffer(new MutationRequest.DeleteRequest<>(id));
        }
        return this;
    }

    @Override
    public CompletableFuture<BatchUpdate<T>> commit() {
        ensureOpen();
        committed = true;
        List<MutationRequest<T>> snapshot = List.copyOf(requests);
        log.debug("Committing transaction of {} request(s)", snapshot.size());
        return target.sequence(() -> TransactionExecutor.execute(target, snapshot).thenApply(result -> {
            BatchUpdate<T> batch = new BatchUpdate<>(result.applied());
            if (result.isSuccess()) {
                target.publish(List.<Update<T>>of(batch));
                return batch;
            }
            if (!batch.isEmpty()) {
                target.publish(List.<Update<T>>of(batch));
            }
            log.warn("Transaction stopped at request {} of {}; {} applied request(s) kept",
                result.failedIndex(), snapshot.size(), batch.updates().size(), result.failure());
            throw result.toException();
        }));
    }

    @Override
    public int size() {
        return requests.size();
    }

    @Override
    public boolean isCommitted() {
        return committed;
    }

    private Transaction<T> buffer(MutationRequest<T> request) {
        ensureOpen();
        requests.add(request);
        return this;
    }

    private void ensureOpen() {
        if (committed) {
            throw new IllegalStateException("transaction already committed");
        }
    }
}
