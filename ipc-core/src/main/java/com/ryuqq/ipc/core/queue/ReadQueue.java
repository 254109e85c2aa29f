package com.ryuqq.ipc.core.queue;

import com.ryuqq.ipc.core.codec.Codecs;
import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.model.QueueMessage;
import com.ryuqq.ipc.core.poll.BlockingPoller;
import com.ryuqq.ipc.core.poll.PollingConfig;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.PayloadCodec;

import java.time.Duration;
import java.util.Optional;

/**
 * Work queue의 consumer 측.
 *
 * <p><strong>전달 보장:</strong> at-most-once. pop된 item은 저장소에서 즉시 제거되며
 * ack나 재전달은 없습니다. 처리 중 프로세스가 죽으면 그 item은 유실됩니다.</p>
 *
 * <p><strong>자기 item 제외:</strong> {@link QueueConfig#excludeOwnMessages()}가 true이면
 * 저장소의 원자적 "prefix가 일치하지 않는 첫 item pop" 명령을 사용합니다.
 * 제외된 item은 list에 그대로 남아 다른 consumer가 가져갑니다.</p>
 *
 * <p><strong>Blocking pop:</strong></p>
 * <ul>
 *   <li>제외 없음: 저장소 native blocking pop을 {@link PollingConfig#nativeBlockSlice()} 단위로
 *       나눠 호출하고, slice 사이에 커넥션을 반환</li>
 *   <li>제외 있음: {@link BlockingPoller}로 조건부 pop을 반복</li>
 *   <li>timeout 0: non-blocking pop 1회</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> thread-safe. 여러 consumer가 같은 queue를 읽어도 각 item은
 * 정확히 한 consumer에게만 전달됩니다 (저장소의 원자적 pop).</p>
 *
 * @param <T> item 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ReadQueue<T> {

    private final ConnectionPool pool;
    private final QueueConfig config;
    private final PayloadCodec<T> codec;
    private final PollingConfig polling;
    private final BlockingPoller poller;
    private final byte[] excludedPrefix;

    public ReadQueue(ConnectionPool pool, QueueConfig config, PayloadCodec<T> codec) {
        this(pool, config, codec, new PollingConfig());
    }

    public ReadQueue(ConnectionPool pool, QueueConfig config, PayloadCodec<T> codec, PollingConfig polling) {
        this(pool, config, codec, polling, new BlockingPoller(polling));
    }

    /**
     * Poller를 주입하는 생성자.
     *
     * @param pool 커넥션 pool
     * @param config queue 설정
     * @param codec item codec
     * @param polling slice 설정
     * @param poller 자기 item 제외 시 사용할 poller
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public ReadQueue(ConnectionPool pool,
                     QueueConfig config,
                     PayloadCodec<T> codec,
                     PollingConfig polling,
                     BlockingPoller poller) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (polling == null) {
            throw new IllegalArgumentException("polling cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        this.pool = pool;
        this.config = config;
        this.codec = codec;
        this.polling = polling;
        this.poller = poller;
        this.excludedPrefix = config.excludeOwnMessages()
            ? QueueFrame.producerPrefix(config.clientId())
            : null;
    }

    /**
     * Non-blocking pop.
     *
     * @return head (또는 첫 번째 대상) item, 없으면 empty
     * @throws com.ryuqq.ipc.core.error.DecodeException item이 손상된 경우 (item은 이미 제거됨)
     */
    public Optional<T> pop() {
        return popMessage().map(QueueMessage::content);
    }

    public Optional<QueueMessage<T>> popMessage() {
        return popFrame().map(this::toMessage);
    }

    /**
     * 설정된 readTimeout 동안 item을 기다림.
     *
     * @return item
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 item이 없는 경우
     */
    public T popBlocking() {
        return popBlocking(config.readTimeout());
    }

    /**
     * 지정한 timeout 동안 item을 기다림.
     *
     * @param timeout 최대 대기 시간 (null 또는 0이면 1회 pop)
     * @return item
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 item이 없는 경우
     * @throws IllegalArgumentException timeout이 음수인 경우
     */
    public T popBlocking(Duration timeout) {
        return popMessageBlocking(timeout).content();
    }

    public QueueMessage<T> popMessageBlocking(Duration timeout) {
        String key = key();
        byte[] frame;
        if (excludedPrefix != null) {
            frame = poller.pollUntil(timeout, this::popFrame);
        } else {
            frame = poller.blockUntil(
                timeout,
                polling.nativeBlockSlice(),
                wait -> pool.execute(connection -> connection.popHeadBlocking(key, wait)),
                this::popFrame);
        }
        return toMessage(frame);
    }

    public long size() {
        String key = key();
        return pool.execute(connection -> connection.listLength(key));
    }

    public ChannelName name() {
        return config.name();
    }

    private Optional<byte[]> popFrame() {
        String key = key();
        if (excludedPrefix != null) {
            return pool.execute(connection -> connection.popHeadExcluding(key, excludedPrefix));
        }
        return pool.execute(connection -> connection.popHead(key));
    }

    private QueueMessage<T> toMessage(byte[] stored) {
        QueueFrame frame = QueueFrame.decode(stored);
        return new QueueMessage<>(frame.id(), frame.producer(), Codecs.decode(codec, frame.payload()));
    }

    private String key() {
        return config.name().getValue();
    }
}
