package com.ryuqq.ipc.core.error;

/**
 * Base type of every runtime failure raised by the IPC primitives.
 *
 * <p>An absent value is never reported through this type: non-blocking reads return
 * {@link java.util.Optional#empty()} and blocking reads raise {@link IpcTimeoutException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class IpcException extends RuntimeException {

    private final IpcErrorKind kind;

    public IpcException(IpcErrorKind kind, String message) {
        super(message);
        this.kind = requireKind(kind);
    }

    public IpcException(IpcErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = requireKind(kind);
    }

    public IpcErrorKind kind() {
        return kind;
    }

    private static IpcErrorKind requireKind(IpcErrorKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return kind;
    }
}
