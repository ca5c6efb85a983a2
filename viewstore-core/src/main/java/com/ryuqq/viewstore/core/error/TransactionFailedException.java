package com.ryuqq.viewstore.core.error;

import com.ryuqq.viewstore.core.update.Update;

import java.util.List;

/**
 * A transaction stopped at its first failing request.
 *
 * <p>Requests before {@link #getFailedIndex()} were applied and are not rolled back; their
 * results are available from {@link #getAppliedUpdates()} and were published as one batch.
 * The failure of the request itself is the {@linkplain #getCause() cause}.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public class TransactionFailedException extends StoreException {

    private final transient List<Update<?>> appliedUpdates;
    private final int failedIndex;

    /**
     * @param appliedUpdates updates of the requests applied before the failure
     * @param failedIndex index of the failing request
     * @param cause failure of that request
     */
    public TransactionFailedException(List<? extends Update<?>> appliedUpdates, int failedIndex, Throwable cause) {
        super(ErrorKind.TRANSACTION_PARTIAL_FAILURE,
            "Transaction failed at request " + failedIndex + " after " + appliedUpdates.size()
                + " applied request(s): " + cause.getMessage(),
            cause);
        this.appliedUpdates = List.copyOf(appliedUpdates);
        this.failedIndex = failedIndex;
    }

    /**
     * Updates of the requests that were applied and kept.
     *
     * @return applied updates, in request order
     */
    public List<Update<?>> getAppliedUpdates() {
        return appliedUpdates;
    }

    /**
     * @return index of the first failing request
     */
    public int getFailedIndex() {
        return failedIndex;
    }
}
