package com.ryuqq.ipc.core.error;

/**
 * Error kinds raised by the IPC primitives.
 *
 * <p>Callers that need finer detail should inspect {@link IpcException#getCause()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum IpcErrorKind {

    /**
     * A blocking read reached its deadline without data. Recoverable.
     */
    TIMEOUT,

    /**
     * No pooled connection became available within the pool's wait bound. Recoverable.
     */
    POOL_EXHAUSTED,

    /**
     * Transport failure or a remote command error. Never retried by the primitives.
     */
    STORE_FAILURE,

    /**
     * A payload could not be encoded.
     */
    SERIALIZATION,

    /**
     * Stored bytes could not be decoded into a payload.
     */
    DECODE,

    /**
     * A stream cursor points before the retention window of the stream.
     */
    CURSOR_EXPIRED,

    /**
     * The calling thread was interrupted while waiting between polls.
     */
    INTERRUPTED;

    /**
     * Checks whether retrying the same call later may succeed.
     *
     * @return true for TIMEOUT, POOL_EXHAUSTED and STORE_FAILURE
     */
    public boolean isTransient() {
        return this == TIMEOUT || this == POOL_EXHAUSTED || this == STORE_FAILURE;
    }
}
