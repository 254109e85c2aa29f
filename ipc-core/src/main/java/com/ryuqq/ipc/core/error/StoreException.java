package com.ryuqq.ipc.core.error;

/**
 * Raised on a transport failure or when the remote store rejects a command.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class StoreException extends IpcException {

    public StoreException(String message) {
        super(IpcErrorKind.STORE_FAILURE, message);
    }

    public StoreException(String message, Throwable cause) {
        super(IpcErrorKind.STORE_FAILURE, message, cause);
    }
}
