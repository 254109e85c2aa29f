package com.ryuqq.ipc.core.error;

/**
 * Raised when a payload cannot be encoded. Shared state is left untouched.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class SerializationException extends IpcException {

    public SerializationException(String message) {
        super(IpcErrorKind.SERIALIZATION, message);
    }

    public SerializationException(String message, Throwable cause) {
        super(IpcErrorKind.SERIALIZATION, message, cause);
    }
}
