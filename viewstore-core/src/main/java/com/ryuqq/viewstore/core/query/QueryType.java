package com.ryuqq.viewstore.core.query;

/**
 * Query discriminant.
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
public enum QueryType {
    FILTER,
    SORT,
    RANGE
}
