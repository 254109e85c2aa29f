package com.ryuqq.ipc.core.codec;

import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.error.IpcException;
import com.ryuqq.ipc.core.error.SerializationException;
import com.ryuqq.ipc.core.spi.PayloadCodec;

/**
 * Calls a {@link PayloadCodec} and normalizes whatever it throws into the IPC error family.
 *
 * <p>Codecs written against this SPI should already throw {@link SerializationException} and
 * {@link DecodeException}; any other runtime exception is wrapped so callers only ever see
 * {@link IpcException}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Codecs {

    private Codecs() {
    }

    public static <T> byte[] encode(PayloadCodec<T> codec, T value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        byte[] bytes;
        try {
            bytes = codec.encode(value);
        } catch (IpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new SerializationException("Failed to encode " + value.getClass().getName(), e);
        }
        if (bytes == null) {
            throw new SerializationException("Codec returned null for " + value.getClass().getName());
        }
        return bytes;
    }

    public static <T> T decode(PayloadCodec<T> codec, byte[] bytes) {
        T value;
        try {
            value = codec.decode(bytes);
        } catch (IpcException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new DecodeException("Failed to decode payload (" + bytes.length + " bytes)", e);
        }
        if (value == null) {
            throw new DecodeException("Codec decoded " + bytes.length + " bytes to null");
        }
        return value;
    }
}
