/**
 * In-memory adapter: a {@link com.ryuqq.viewstore.core.spi.Storage} over an ordered list and id
 * map, and the {@link com.ryuqq.viewstore.adapter.inmemory.InMemoryStores} factory.
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.adapter.inmemory;
