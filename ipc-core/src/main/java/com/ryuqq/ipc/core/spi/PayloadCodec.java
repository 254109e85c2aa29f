package com.ryuqq.ipc.core.spi;

/**
 * Serialization SPI for the payload type carried by a primitive.
 *
 * <p>A codec is passed explicitly to each cache, queue or stream at construction; the
 * primitives never resolve it by reflection. Implementations are format-agnostic (JSON,
 * plain text, Protobuf...) and must be thread-safe.</p>
 *
 * @param <T> payload type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PayloadCodec<T> {

    /**
     * @param value payload, never null
     * @return encoded bytes
     * @throws com.ryuqq.ipc.core.error.SerializationException if the value cannot be encoded
     */
    byte[] encode(T value);

    /**
     * @param bytes encoded bytes as read from the store
     * @return decoded payload
     * @throws com.ryuqq.ipc.core.error.DecodeException if the bytes are not a valid payload
     */
    T decode(byte[] bytes);
}
