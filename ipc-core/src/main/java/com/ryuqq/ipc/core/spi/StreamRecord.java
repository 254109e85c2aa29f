package com.ryuqq.ipc.core.spi;

import com.ryuqq.ipc.core.model.StreamCursor;

/**
 * Raw stream entry as returned by the store, before decoding.
 *
 * <p>The payload array is handed over, not copied; callers must not modify it.</p>
 *
 * @param id entry id
 * @param payload encoded entry content
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamRecord(StreamCursor id, byte[] payload) {

    public StreamRecord {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
    }
}
