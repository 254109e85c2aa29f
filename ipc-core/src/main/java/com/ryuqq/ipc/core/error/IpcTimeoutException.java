package com.ryuqq.ipc.core.error;

/**
 * Raised when a blocking read reaches its deadline with no data.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class IpcTimeoutException extends IpcException {

    public IpcTimeoutException(String message) {
        super(IpcErrorKind.TIMEOUT, message);
    }

    public IpcTimeoutException(String message, Throwable cause) {
        super(IpcErrorKind.TIMEOUT, message, cause);
    }
}
