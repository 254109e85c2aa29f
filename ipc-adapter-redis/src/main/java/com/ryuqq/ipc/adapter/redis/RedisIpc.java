package com.ryuqq.ipc.adapter.redis;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;

/**
 * Entry point for building a Redis-backed {@link com.ryuqq.ipc.core.spi.ConnectionPool}.
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (ConnectionPool pool = RedisIpc.connect("redis://localhost:6379")) {
 *     WriteQueue&lt;String&gt; jobs = new WriteQueue&lt;&gt;(pool, QueueConfig.of("jobs"), Utf8StringCodec.instance());
 *     jobs.push("job-1");
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RedisIpc {

    private RedisIpc() {
    }

    /**
     * 기본 pool 설정으로 연결합니다.
     *
     * @param uri Redis URI (예: {@code redis://localhost:6379/0})
     * @return pool owning its own client
     */
    public static LettuceConnectionPool connect(String uri) {
        return connect(uri, new RedisPoolConfig());
    }

    /**
     * pool 설정을 지정하여 연결합니다.
     *
     * <p>반환된 pool을 close하면 내부 RedisClient도 함께 종료됩니다.</p>
     *
     * @param uri Redis URI
     * @param config pool 설정
     * @return pool owning its own client
     */
    public static LettuceConnectionPool connect(String uri, RedisPoolConfig config) {
        if (uri == null || uri.isBlank()) {
            throw new IllegalArgumentException("uri cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        RedisURI redisUri = RedisURI.create(uri);
        RedisClient client = RedisClient.create();
        try {
            return new LettuceConnectionPool(client, redisUri, config, client::shutdown);
        } catch (RuntimeException e) {
            client.shutdown();
            throw e;
        }
    }
}
