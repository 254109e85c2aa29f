package com.ryuqq.ipc.core.cache;

import com.ryuqq.ipc.core.error.DecodeException;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * Cache 값의 저장 형식: {@code [8 byte write millis (big endian)][payload]}.
 */
final class CacheFrame {

    static final int HEADER_LENGTH = Long.BYTES;

    private final long writtenAtMillis;
    private final byte[] payload;

    private CacheFrame(long writtenAtMillis, byte[] payload) {
        this.writtenAtMillis = writtenAtMillis;
        this.payload = payload;
    }

    static byte[] encode(long writtenAtMillis, byte[] payload) {
        return ByteBuffer.allocate(HEADER_LENGTH + payload.length)
            .putLong(writtenAtMillis)
            .put(payload)
            .array();
    }

    static CacheFrame decode(byte[] frame) {
        if (frame.length < HEADER_LENGTH) {
            throw new DecodeException(
                "Cache value too short: " + frame.length + " bytes, header needs " + HEADER_LENGTH);
        }
        long millis = ByteBuffer.wrap(frame, 0, HEADER_LENGTH).getLong();
        return new CacheFrame(millis, Arrays.copyOfRange(frame, HEADER_LENGTH, frame.length));
    }

    long writtenAtMillis() {
        return writtenAtMillis;
    }

    byte[] payload() {
        return payload;
    }
}
