package com.ryuqq.ipc.core.queue;

import com.ryuqq.ipc.core.codec.Codecs;
import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.PayloadCodec;

import java.util.UUID;

/**
 * Work queue의 producer 측.
 *
 * <p>item은 list의 tail에 추가되고 {@link ReadQueue}는 head에서 꺼내므로 FIFO 순서가
 * 유지됩니다. 각 item에는 UUID 메시지 id와 producer ({@link QueueConfig#clientId()})가
 * 함께 기록됩니다.</p>
 *
 * <p><strong>동시성:</strong> thread-safe. push 한 번이 원격 round trip 한 번입니다.</p>
 *
 * @param <T> item 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class WriteQueue<T> {

    private final ConnectionPool pool;
    private final QueueConfig config;
    private final PayloadCodec<T> codec;

    public WriteQueue(ConnectionPool pool, QueueConfig config, PayloadCodec<T> codec) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        this.pool = pool;
        this.config = config;
        this.codec = codec;
    }

    /**
     * Queue tail에 item 추가.
     *
     * @param item 추가할 item
     * @return 부여된 메시지 id
     * @throws com.ryuqq.ipc.core.error.SerializationException 직렬화 실패 시
     * @throws com.ryuqq.ipc.core.error.StoreException 저장소 오류
     */
    public String push(T item) {
        String id = UUID.randomUUID().toString();
        byte[] frame = QueueFrame.encode(config.clientId(), id, Codecs.encode(codec, item));
        String key = config.name().getValue();
        pool.execute(connection -> {
            connection.pushTail(key, frame);
            return null;
        });
        return id;
    }

    public long size() {
        String key = config.name().getValue();
        return pool.execute(connection -> connection.listLength(key));
    }

    public ChannelName name() {
        return config.name();
    }
}
