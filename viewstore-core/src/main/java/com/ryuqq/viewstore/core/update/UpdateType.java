package com.ryuqq.viewstore.core.update;

/**
 * Update event discriminant.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public enum UpdateType {
    ADDED,
    UPDATED,
    DELETED,
    BATCH
}
