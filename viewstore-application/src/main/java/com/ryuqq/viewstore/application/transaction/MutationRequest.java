package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.patch.Patch;
import com.ryuqq.viewstore.core.update.Update;

import java.util.concurrent.CompletableFuture;

/**
 * One buffered request of a transaction.
 *
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public sealed interface MutationRequest<T>
    permits MutationRequest.AddRequest, MutationRequest.PutRequest,
            MutationRequest.PatchRequest, MutationRequest.DeleteRequest {

    CompletableFuture<? extends Update<T>> execute(MutationTarget<T> target);

    record AddRequest<T>(T item) implements MutationRequest<T> {

        public AddRequest {
            if (item == null) {
                throw new IllegalArgumentException("item cannot be null");
            }
        }

        @Override
        public CompletableFuture<? extends Update<T>> execute(MutationTarget<T> target) {
            return target.applyAdd(item);
        }
    }

    /**
     * Update when the id is present at execution time, add otherwise.
     */
    record PutRequest<T>(T item) implements MutationRequest<T> {

        public PutRequest {
            if (item == null) {
                throw new IllegalArgumentException("item cannot be null");
            }
        }

        @Override
        public CompletableFuture<? extends Update<T>> execute(MutationTarget<T> target) {
            if (target.isUpdate(item)) {
                return target.applyPut(item);
            }
            return target.applyAdd(item);
        }
    }

    record PatchRequest<T>(String id, Patch patch) implements MutationRequest<T> {

        public PatchRequest {
            if (id == null) {
                throw new IllegalArgumentException("id cannot be null");
            }
            if (patch == null) {
                throw new IllegalArgumentException("patch cannot be null");
            }
        }

        @Override
        public CompletableFuture<? extends Update<T>> execute(MutationTarget<T> target) {
            return target.applyPatch(id, patch);
        }
    }

    record DeleteRequest<T>(String id) implements MutationRequest<T> {

        public DeleteRequest {
            if (id == null) {
                throw new IllegalArgumentException("id cannot be null");
            }
        }

        @Override
        public CompletableFuture<? extends Update<T>> execute(MutationTarget<T> target) {
            return target.applyDelete(id);
        }
    }
}
