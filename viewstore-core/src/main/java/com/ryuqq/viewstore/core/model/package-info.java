/**
 * Data model: items, identity, and the ordered data / id map pair.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.viewstore.core.model.ItemMapper} - item to Jackson tree conversion and deep copy</li>
 *   <li>{@link com.ryuqq.viewstore.core.model.ItemIdentity} - id extraction and assignment</li>
 *   <li>{@link com.ryuqq.viewstore.core.model.IndexedEntry} - item plus position</li>
 *   <li>{@link com.ryuqq.viewstore.core.model.IdMap} - id to entry index</li>
 *   <li>{@link com.ryuqq.viewstore.core.model.IndexedData} - ordered data kept consistent with its map</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.core.model;
