package com.ryuqq.ipc.core.spi;

/**
 * A borrowed {@link StoreConnection} whose lifetime is bound to a try-with-resources scope.
 *
 * <p>{@link #close()} returns the connection to its pool. It is idempotent, and a closed
 * handle must not be used again.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ScopedConnection extends StoreConnection, AutoCloseable {

    /**
     * Returns the connection to the pool. Calling it more than once has no further effect.
     */
    @Override
    void close();
}
