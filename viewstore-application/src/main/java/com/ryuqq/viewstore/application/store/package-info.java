/**
 * Store core: the uniform {@link com.ryuqq.viewstore.application.store.Store} contract and its
 * two roles.
 *
 * <h2>Roles</h2>
 * <ul>
 *   <li>{@link com.ryuqq.viewstore.application.store.RootStore} - owns a storage, versions and
 *       sequences every mutation, publishes events</li>
 *   <li>{@link com.ryuqq.viewstore.application.store.DerivedView} - query pipeline over a root;
 *       cold (recompute on version change) or live (incremental)</li>
 * </ul>
 *
 * <p>Views never chain: a view of a view is a view of the same root with the query lists
 * concatenated.</p>
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.application.store;
