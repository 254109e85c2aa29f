/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams the primitives depend on and adapters implement.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ipc.core.spi.ConnectionPool} - bounded, health-checked connection pool</li>
 *   <li>{@link com.ryuqq.ipc.core.spi.ScopedConnection} - borrowed connection released on close</li>
 *   <li>{@link com.ryuqq.ipc.core.spi.StoreConnection} - primitive remote commands</li>
 *   <li>{@link com.ryuqq.ipc.core.spi.PayloadCodec} - payload encoding</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (ipc-adapter-inmemory, ipc-adapter-redis) provide the pool and the store
 * commands; ipc-codec-jackson provides a JSON codec.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> core does not depend on any store client library</li>
 *   <li><strong>Store-side atomicity:</strong> data consistency comes from atomic store commands, never client locks</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.core.spi;
