/**
 * Transaction manager.
 *
 * <p>Every root mutation, plain or transactional, runs through a
 * {@link com.ryuqq.viewstore.application.transaction.MutationSequencer}, so at most one is in
 * flight per root store. Transactions are sequential and non-atomic: see
 * {@link com.ryuqq.viewstore.application.transaction.Transaction}.</p>
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.application.transaction;
