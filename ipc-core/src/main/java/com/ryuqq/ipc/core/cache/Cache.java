package com.ryuqq.ipc.core.cache;

import com.ryuqq.ipc.core.codec.Codecs;
import com.ryuqq.ipc.core.model.CacheEntry;
import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.poll.BlockingPoller;
import com.ryuqq.ipc.core.poll.Timeouts;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.PayloadCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 원격 저장소 위의 공유 key/value cache.
 *
 * <p>여러 프로세스가 같은 이름의 Cache를 열어 값을 공유합니다. 로컬 캐싱은 하지 않으며
 * 모든 호출이 원격 저장소 round trip 한 번입니다 (blocking 조회는 poll마다 한 번).</p>
 *
 * <p><strong>저장 형식:</strong></p>
 * <ul>
 *   <li>키: {@code <name>#<key>}</li>
 *   <li>값: {@code [8 byte write millis][payload]}</li>
 *   <li>만료: 저장소의 TTL 기능에 위임</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> thread-safe. 같은 키에 대한 동시 쓰기는 저장소 기준으로
 * 마지막 쓰기가 남습니다 (last-writer-wins).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Cache&lt;String&gt; sessions = new Cache&lt;&gt;(pool,
 *     CacheConfig.of("sessions").withTtl(Duration.ofMinutes(5)),
 *     Utf8StringCodec.instance());
 *
 * sessions.set("u1", "token");
 * String token = sessions.getBlocking("u2", Duration.ofSeconds(1));
 * </pre>
 *
 * @param <T> 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Cache<T> {

    private final ConnectionPool pool;
    private final CacheConfig config;
    private final PayloadCodec<T> codec;
    private final BlockingPoller poller;
    private final Clock clock;

    public Cache(ConnectionPool pool, CacheConfig config, PayloadCodec<T> codec) {
        this(pool, config, codec, new BlockingPoller(), Clock.systemUTC());
    }

    /**
     * Poller와 시계를 주입하는 생성자.
     *
     * @param pool 커넥션 pool
     * @param config cache 설정
     * @param codec 값 codec
     * @param poller blocking 조회에 사용할 poller
     * @param clock write timestamp 시계
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public Cache(ConnectionPool pool,
                 CacheConfig config,
                 PayloadCodec<T> codec,
                 BlockingPoller poller,
                 Clock clock) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (poller == null) {
            throw new IllegalArgumentException("poller cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.pool = pool;
        this.config = config;
        this.codec = codec;
        this.poller = poller;
        this.clock = clock;
    }

    /**
     * 설정된 기본 TTL로 값 저장.
     *
     * @param key 키
     * @param value 값
     */
    public void set(String key, T value) {
        set(key, value, config.ttl());
    }

    /**
     * 지정한 TTL로 값 저장. 기존 값과 만료 시간은 모두 교체됩니다.
     *
     * @param key 키
     * @param value 값
     * @param ttl 만료 시간 (null 또는 0이면 만료 없음)
     * @throws IllegalArgumentException ttl이 음수인 경우
     * @throws com.ryuqq.ipc.core.error.SerializationException 직렬화 실패 시
     */
    public void set(String key, T value, Duration ttl) {
        Timeouts.requireNonNegative("ttl", ttl);
        String storeKey = storeKey(key);
        byte[] frame = CacheFrame.encode(clock.millis(), Codecs.encode(codec, value));
        pool.execute(connection -> {
            connection.set(storeKey, frame, ttl);
            return null;
        });
    }

    /**
     * Non-blocking 조회.
     *
     * @param key 키
     * @return 값, 없거나 만료된 경우 empty
     * @throws com.ryuqq.ipc.core.error.StoreException 저장소 오류
     * @throws com.ryuqq.ipc.core.error.DecodeException 저장된 값이 손상된 경우
     */
    public Optional<T> get(String key) {
        return getEntry(key).map(CacheEntry::content);
    }

    /**
     * 값과 기록 시각을 함께 조회.
     *
     * @param key 키
     * @return entry, 없거나 만료된 경우 empty
     */
    public Optional<CacheEntry<T>> getEntry(String key) {
        return fetch(storeKey(key));
    }

    /**
     * 설정된 readTimeout 동안 값이 나타나기를 기다림.
     *
     * @param key 키
     * @return 값
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 값이 없는 경우
     */
    public T getBlocking(String key) {
        return getBlocking(key, config.readTimeout());
    }

    /**
     * 지정한 timeout 동안 값이 나타나기를 기다림. poll 사이에는 커넥션을 점유하지 않습니다.
     *
     * @param key 키
     * @param timeout 최대 대기 시간 (null 또는 0이면 1회 조회)
     * @return 값
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 값이 없는 경우
     */
    public T getBlocking(String key, Duration timeout) {
        String storeKey = storeKey(key);
        return poller.pollUntil(timeout, () -> fetch(storeKey).map(CacheEntry::content));
    }

    public boolean exists(String key) {
        String storeKey = storeKey(key);
        return pool.execute(connection -> connection.exists(storeKey));
    }

    public boolean delete(String key) {
        String storeKey = storeKey(key);
        return pool.execute(connection -> connection.delete(storeKey));
    }

    public ChannelName name() {
        return config.name();
    }

    private Optional<CacheEntry<T>> fetch(String storeKey) {
        return pool.execute(connection -> connection.get(storeKey))
            .map(this::toEntry);
    }

    private CacheEntry<T> toEntry(byte[] stored) {
        CacheFrame frame = CacheFrame.decode(stored);
        T content = Codecs.decode(codec, frame.payload());
        return new CacheEntry<>(content, Instant.ofEpochMilli(frame.writtenAtMillis()));
    }

    private String storeKey(String key) {
        return config.name().child(key);
    }
}
