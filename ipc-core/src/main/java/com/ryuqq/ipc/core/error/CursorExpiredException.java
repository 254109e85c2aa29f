package com.ryuqq.ipc.core.error;

import com.ryuqq.ipc.core.model.StreamCursor;

/**
 * Raised when a stream cursor refers to an entry that was trimmed out of the stream.
 *
 * <p>The entries between the stale cursor and {@link #getFirstRetained()} are lost for this
 * reader. Callers re-synchronize explicitly, for example with
 * {@link com.ryuqq.ipc.core.stream.StreamReader#resync()}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class CursorExpiredException extends IpcException {

    private final StreamCursor staleCursor;
    private final StreamCursor firstRetained;

    /**
     * @param stream stream key
     * @param staleCursor cursor held by the reader
     * @param firstRetained oldest entry still in the stream, or null when the stream is empty
     */
    public CursorExpiredException(String stream, StreamCursor staleCursor, StreamCursor firstRetained) {
        super(IpcErrorKind.CURSOR_EXPIRED,
            "Cursor " + (staleCursor == null ? "null" : staleCursor.getValue()) + " on stream '" + stream
                + "' is outside the retention window (first retained: "
                + (firstRetained == null ? "none" : firstRetained.getValue()) + ")");
        this.staleCursor = staleCursor;
        this.firstRetained = firstRetained;
    }

    public StreamCursor getStaleCursor() {
        return staleCursor;
    }

    /**
     * @return oldest retained entry, or null when the stream holds no entries
     */
    public StreamCursor getFirstRetained() {
        return firstRetained;
    }
}
