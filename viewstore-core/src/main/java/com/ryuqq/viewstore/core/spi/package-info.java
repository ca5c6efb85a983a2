/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.viewstore.core.spi.Storage} - authoritative item sequence of a root store</li>
 *   <li>{@link com.ryuqq.viewstore.core.spi.StorageFactory} - storage construction over seed data</li>
 *   <li>{@link com.ryuqq.viewstore.core.spi.Subscriber} - update event receiver</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (e.g., viewstore-adapter-inmemory) provide storages. A network or disk
 * backed storage plugs in the same way.</p>
 *
 * @since 1.0.0
 * @author ViewStore Team
 */
package com.ryuqq.viewstore.core.spi;
