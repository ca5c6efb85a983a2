package com.ryuqq.viewstore.core.error;

/**
 * Failure categories reported by the store.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /** add of an id already present in the store. */
    DUPLICATE_ID,

    /** get/put/patch/delete referencing an absent id. */
    NOT_FOUND,

    /** query-string form requested for an opaque predicate or comparator. */
    NOT_SERIALIZABLE,

    /** a transaction failed partway; applied requests are not undone. */
    TRANSACTION_PARTIAL_FAILURE,

    /** a patch operation could not be applied to its target. */
    PATCH_CONFLICT,

    /** an item could not be converted to or from its tree form. */
    INVALID_ITEM
}
