package com.ryuqq.ipc.core.spi;

import java.util.function.Function;

/**
 * Connection pool SPI for reaching the remote store.
 *
 * <p>The pool is process-wide shared state. It is constructed explicitly and passed to every
 * primitive, never looked up through a singleton, so tests can substitute a fake store.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: {@link #acquire()} may be called from many threads at once</li>
 *   <li>Bounded: at most a configured number of connections are handed out at a time</li>
 *   <li>Bounded wait: {@link #acquire()} blocks at most the configured wait, then fails</li>
 *   <li>Health-checked: a connection handed out has been validated by the pool</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * try (ScopedConnection connection = pool.acquire()) {
 *     connection.set("session:u1", bytes, Duration.ofSeconds(2));
 * } // released here on success, early return or error
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Borrows a connection from the pool.
     *
     * @return a connection that goes back to the pool when closed
     * @throws com.ryuqq.ipc.core.error.PoolExhaustedException if no connection became available in time
     * @throws com.ryuqq.ipc.core.error.StoreException if a new connection could not be established
     * @throws IllegalStateException if the pool was closed
     */
    ScopedConnection acquire();

    /**
     * Runs one round trip on a borrowed connection and releases it before returning.
     *
     * @param action commands to issue on the connection
     * @param <R> result type
     * @return the action's result
     */
    default <R> R execute(Function<StoreConnection, R> action) {
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        try (ScopedConnection connection = acquire()) {
            return action.apply(connection);
        }
    }

    /**
     * Shuts the pool down and closes idle connections.
     */
    @Override
    void close();
}
