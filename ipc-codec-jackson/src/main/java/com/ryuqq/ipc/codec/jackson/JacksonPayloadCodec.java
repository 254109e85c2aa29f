package com.ryuqq.ipc.codec.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.error.SerializationException;
import com.ryuqq.ipc.core.spi.PayloadCodec;

import java.io.IOException;

/**
 * JSON payload codec backed by a Jackson {@link ObjectMapper}.
 *
 * <p>The target type is fixed at construction, either as a {@link Class} or, for generic
 * payloads such as {@code List<Order>}, as a {@link TypeReference}. Jackson failures are
 * mapped to {@link SerializationException} on encode and {@link DecodeException} on decode.</p>
 *
 * <p>The default mapper ignores unknown properties, so peers running an older payload class
 * can still read events written by newer ones.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * PayloadCodec&lt;Order&gt; orders = JacksonPayloadCodec.of(Order.class);
 * PayloadCodec&lt;List&lt;Order&gt;&gt; batches = JacksonPayloadCodec.of(new TypeReference&lt;&gt;() {});
 * </pre>
 *
 * @param <T> payload type
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JacksonPayloadCodec<T> implements PayloadCodec<T> {

    private final ObjectMapper mapper;
    private final JavaType type;

    private JacksonPayloadCodec(ObjectMapper mapper, JavaType type) {
        this.mapper = mapper;
        this.type = type;
    }

    public static <T> JacksonPayloadCodec<T> of(Class<T> type) {
        return of(defaultMapper(), type);
    }

    public static <T> JacksonPayloadCodec<T> of(TypeReference<T> type) {
        return of(defaultMapper(), type);
    }

    /**
     * @param mapper mapper to use (shared, must not be reconfigured afterwards)
     * @param type payload class
     * @param <T> payload type
     * @return codec
     * @throws IllegalArgumentException if an argument is null
     */
    public static <T> JacksonPayloadCodec<T> of(ObjectMapper mapper, Class<T> type) {
        requireMapper(mapper);
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new JacksonPayloadCodec<>(mapper, mapper.getTypeFactory().constructType(type));
    }

    public static <T> JacksonPayloadCodec<T> of(ObjectMapper mapper, TypeReference<T> type) {
        requireMapper(mapper);
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        return new JacksonPayloadCodec<>(mapper, mapper.getTypeFactory().constructType(type));
    }

    /**
     * Mapper used when none is supplied: default Jackson settings, unknown properties ignored.
     *
     * @return a new mapper
     */
    public static ObjectMapper defaultMapper() {
        return JsonMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    @Override
    public byte[] encode(T value) {
        try {
            return mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to serialize " + type + " to JSON", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        try {
            return mapper.readValue(bytes, type);
        } catch (IOException e) {
            throw new DecodeException("Failed to deserialize JSON to " + type, e);
        }
    }

    public JavaType getType() {
        return type;
    }

    private static void requireMapper(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
    }
}
