package com.ryuqq.ipc.core.error;

/**
 * Raised when bytes read from the store cannot be decoded into a payload.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class DecodeException extends IpcException {

    public DecodeException(String message) {
        super(IpcErrorKind.DECODE, message);
    }

    public DecodeException(String message, Throwable cause) {
        super(IpcErrorKind.DECODE, message, cause);
    }
}
