/**
 * Query algebra: filter, sort and range steps of a view pipeline.
 *
 * <p>{@link com.ryuqq.viewstore.core.query.Query} is sealed over
 * {@link com.ryuqq.viewstore.core.query.Filter}, {@link com.ryuqq.viewstore.core.query.Sort} and
 * {@link com.ryuqq.viewstore.core.query.Range}. Structured filters and property sorts have a
 * query-string form ({@link com.ryuqq.viewstore.core.query.RqlQuerySerializer} by default);
 * opaque predicates and comparators do not.</p>
 *
 * @author ViewStore Team
 * @since 1.0.0
 */
package com.ryuqq.viewstore.core.query;
