package com.ryuqq.ipc.core.queue;

import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.model.ClientId;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Queue item의 저장 형식.
 *
 * <pre>
 * [2 byte producer 길이][producer UTF-8][2 byte id 길이][id UTF-8][payload]
 * </pre>
 *
 * <p>producer가 길이 prefix와 함께 맨 앞에 오므로 {@link #producerPrefix(ClientId)}로
 * 시작하는 frame은 정확히 그 producer가 push한 item입니다.
 * 익명 producer는 길이 0으로 기록됩니다.</p>
 */
final class QueueFrame {

    private final ClientId producer;
    private final String id;
    private final byte[] payload;

    private QueueFrame(ClientId producer, String id, byte[] payload) {
        this.producer = producer;
        this.id = id;
        this.payload = payload;
    }

    static byte[] encode(ClientId producer, String id, byte[] payload) {
        byte[] producerBytes = producer == null
            ? new byte[0]
            : producer.getValue().getBytes(StandardCharsets.UTF_8);
        byte[] idBytes = id.getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(2 + producerBytes.length + 2 + idBytes.length + payload.length)
            .putShort((short) producerBytes.length)
            .put(producerBytes)
            .putShort((short) idBytes.length)
            .put(idBytes)
            .put(payload)
            .array();
    }

    static byte[] producerPrefix(ClientId producer) {
        byte[] producerBytes = producer.getValue().getBytes(StandardCharsets.UTF_8);
        return ByteBuffer.allocate(2 + producerBytes.length)
            .putShort((short) producerBytes.length)
            .put(producerBytes)
            .array();
    }

    static QueueFrame decode(byte[] frame) {
        ByteBuffer buffer = ByteBuffer.wrap(frame);
        try {
            String producerValue = readString(buffer);
            String id = readString(buffer);
            byte[] payload = new byte[buffer.remaining()];
            buffer.get(payload);
            ClientId producer = producerValue.isEmpty() ? null : ClientId.of(producerValue);
            return new QueueFrame(producer, id, payload);
        } catch (BufferUnderflowException | IllegalArgumentException e) {
            throw new DecodeException("Malformed queue item (" + frame.length + " bytes)", e);
        }
    }

    private static String readString(ByteBuffer buffer) {
        int length = Short.toUnsignedInt(buffer.getShort());
        if (length > buffer.remaining()) {
            throw new BufferUnderflowException();
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    ClientId producer() {
        return producer;
    }

    String id() {
        return id;
    }

    byte[] payload() {
        return payload;
    }
}
