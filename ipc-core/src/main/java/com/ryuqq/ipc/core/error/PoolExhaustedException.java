package com.ryuqq.ipc.core.error;

/**
 * Raised when the connection pool hands out no connection within its wait bound.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PoolExhaustedException extends IpcException {

    public PoolExhaustedException(String message) {
        super(IpcErrorKind.POOL_EXHAUSTED, message);
    }

    public PoolExhaustedException(String message, Throwable cause) {
        super(IpcErrorKind.POOL_EXHAUSTED, message, cause);
    }
}
