/**
 * Failure types of the store.
 *
 * <p>All failures extend {@link com.ryuqq.viewstore.core.error.StoreException} and carry an
 * {@link com.ryuqq.viewstore.core.error.ErrorKind}. They are delivered as exceptionally completed
 * futures, never swallowed, and never retried by the core.</p>
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.core.error;
