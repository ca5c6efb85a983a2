package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.update.Update;
import com.ryuqq.viewstore.core.util.Futures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Executes requests one after another, stopping at the first failure.
 *
 * <p>Applied requests are never undone. The returned future always completes normally; the
 * failure, if any, is carried by the {@link ExecutionResult}.</p>
 *
 * <p>Requests whose future is already complete are consumed in a loop, so a synchronous
 * storage runs any number of requests in constant stack depth. Only a request that is still
 * pending resumes the loop from its completion callback.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public final class TransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(TransactionExecutor.class);

    private TransactionExecutor() {
    }

    /**
     * Runs the requests in order against the target.
     *
     * @param target mutation target
     * @param requests requests to run, in order
     * @param <T> item type
     * @return future of the execution result, never completed exceptionally
     * @throws IllegalArgumentException if target or requests is null
     */
    public static <T> CompletableFuture<ExecutionResult<T>> execute(MutationTarget<T> target,
                                                                    List<MutationRequest<T>> requests) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }
        return resume(target, List.copyOf(requests), 0, new ArrayList<>(requests.size()));
    }

    private static <T> CompletableFuture<ExecutionResult<T>> resume(MutationTarget<T> target,
                                                                   List<MutationRequest<T>> requests,
                                                                   int from,
                                                                   List<Update<T>> applied) {
        for (int index = from; index < requests.size(); index++) {
            CompletableFuture<? extends Update<T>> stage = start(requests.get(index), target);
            if (!stage.isDone()) {
                int pending = index;
                return stage
                    .handle((update, error) -> error != null
                        ? failed(requests, pending, applied, error)
                        : accept(target, requests, pending, applied, update))
                    .thenCompose(next -> next);
            }
            if (stage.isCompletedExceptionally()) {
                Throwable error = stage.handle((update, failure) -> failure).join();
                return failed(requests, index, applied, error);
            }
            applied.add(stage.join());
        }
        return CompletableFuture.completedFuture(ExecutionResult.success(applied));
    }

    private static <T> CompletableFuture<ExecutionResult<T>> accept(MutationTarget<T> target,
                                                                   List<MutationRequest<T>> requests,
                                                                   int index,
                                                                   List<Update<T>> applied,
                                                                   Update<T> update) {
        applied.add(update);
        return resume(target, requests, index + 1, applied);
    }

    private static <T> CompletableFuture<ExecutionResult<T>> failed(List<MutationRequest<T>> requests,
                                                                   int index,
                                                                   List<Update<T>> applied,
                                                                   Throwable error) {
        Throwable cause = Futures.unwrap(error);
        log.debug("Request {} of {} failed: {}", index, requests.size(), cause.toString());
        return CompletableFuture.completedFuture(ExecutionResult.failure(applied, index, cause));
    }

    private static <T> CompletableFuture<? extends Update<T>> start(MutationRequest<T> request,
                                                                    MutationTarget<T> target) {
        try {
            return request.execute(target);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
