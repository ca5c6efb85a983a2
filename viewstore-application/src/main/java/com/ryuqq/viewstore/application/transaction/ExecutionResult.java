package com.ryuqq.viewstore.application.transaction;

import com.ryuqq.viewstore.core.error.TransactionFailedException;
import com.ryuqq.viewstore.core.update.Update;

import java.util.List;

/**
 * Outcome of executing a request sequence: the applied results and, if execution stopped
 * early, the failing request.
 *
 * @param applied results of the requests that succeeded, in order
 * @param failedIndex index of the failing request, or -1 on success
 * @param failure failure of that request, or null on success
 * @param <T> item type
 * @author ViewStore Team
 * @since 1.0.0
 */
public record ExecutionResult<T>(List<Update<T>> applied, int failedIndex, Throwable failure) {

    public ExecutionResult {
        applied = List.copyOf(applied);
        if ((failure == null) != (failedIndex < 0)) {
            throw new IllegalArgumentException("failedIndex and failure must be set together");
        }
    }

    /**
     * Every request was applied.
     *
     * @param applied per-request updates, in order
     * @param <T> item type
     * @return successful result
     */
    public static <T> ExecutionResult<T> success(List<Update<T>> applied) {
        return new ExecutionResult<>(applied, -1, null);
    }

    /**
     * Execution stopped at a failing request.
     *
     * @param applied updates of the requests before the failing one
     * @param failedIndex index of the failing request
     * @param failure its failure
     * @param <T> item type
     * @return failed result
     */
    public static <T> ExecutionResult<T> failure(List<Update<T>> applied, int failedIndex, Throwable failure) {
        return new ExecutionResult<>(applied, failedIndex, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    /**
     * Exception reporting this failed result.
     *
     * @return exception carrying the applied updates, the failed index and the cause
     * @throws IllegalStateException if the result is a success
     */
    public TransactionFailedException toException() {
        if (isSuccess()) {
            throw new IllegalStateException("execution succeeded");
        }
        return new TransactionFailedException(applied, failedIndex, failure);
    }
}
