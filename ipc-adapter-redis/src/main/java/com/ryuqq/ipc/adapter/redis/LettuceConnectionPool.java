package com.ryuqq.ipc.adapter.redis;

import com.ryuqq.ipc.core.error.PoolExhaustedException;
import com.ryuqq.ipc.core.error.StoreException;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.ScopedConnection;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.ByteArrayCodec;
import io.lettuce.core.codec.RedisCodec;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.support.ConnectionPoolSupport;
import org.apache.commons.pool2.ObjectPool;
import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link ConnectionPool} over Lettuce connections held in a commons-pool2 object pool.
 *
 * <p>Keys are UTF-8 strings and values raw bytes, so framed payloads reach Redis unchanged.
 * Each borrowed connection is handed out as a {@link RedisStoreConnection}; closing it returns
 * the connection to the pool, or invalidates it when a command hit a connection failure.</p>
 *
 * <p><strong>Borrow Rules:</strong></p>
 * <ul>
 *   <li>{@link #acquire()} waits at most {@link RedisPoolConfig#maxWait()}, then fails with
 *       {@link PoolExhaustedException}</li>
 *   <li>A connection that cannot be opened or fails validation surfaces as {@link StoreException}</li>
 *   <li>{@link #close()} closes the object pool, and shuts the client down if this pool created it</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class LettuceConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(LettuceConnectionPool.class);

    static final RedisCodec<String, byte[]> CODEC = RedisCodec.of(StringCodec.UTF8, ByteArrayCodec.INSTANCE);

    private final ObjectPool<StatefulRedisConnection<String, byte[]>> pool;
    private final Duration maxWait;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a pool over an existing client. The client stays owned by the caller.
     *
     * @param client Lettuce client
     * @param uri Redis endpoint
     * @param config pool limits
     */
    public LettuceConnectionPool(RedisClient client, RedisURI uri, RedisPoolConfig config) {
        this(client, uri, config, () -> { });
    }

    /**
     * @param onClose runs after the object pool is closed (client shutdown for owned clients)
     */
    LettuceConnectionPool(RedisClient client, RedisURI uri, RedisPoolConfig config, Runnable onClose) {
        this(createPool(client, uri, config), config.maxWait(), onClose);
        log.info("Redis connection pool created: host={}, port={}, maxTotal={}, maxWait={}",
            uri.getHost(), uri.getPort(), config.maxTotal(), config.maxWait());
    }

    LettuceConnectionPool(
        ObjectPool<StatefulRedisConnection<String, byte[]>> pool,
        Duration maxWait,
        Runnable onClose
    ) {
        if (pool == null) {
            throw new IllegalArgumentException("pool cannot be null");
        }
        this.pool = pool;
        this.maxWait = maxWait;
        this.onClose = onClose;
    }

    private static ObjectPool<StatefulRedisConnection<String, byte[]>> createPool(
        RedisClient client,
        RedisURI uri,
        RedisPoolConfig config
    ) {
        if (client == null || uri == null || config == null) {
            throw new IllegalArgumentException("client, uri and config cannot be null");
        }
        RedisURI endpoint = RedisURI.builder(uri).withTimeout(config.commandTimeout()).build();

        GenericObjectPoolConfig<StatefulRedisConnection<String, byte[]>> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(config.maxTotal());
        poolConfig.setMaxIdle(config.maxTotal());
        poolConfig.setMinIdle(config.minIdle());
        poolConfig.setMaxWait(config.maxWait());
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setTestOnBorrow(config.testOnBorrow());
        poolConfig.setJmxEnabled(false);

        return ConnectionPoolSupport.createGenericObjectPool(() -> client.connect(CODEC, endpoint), poolConfig, false);
    }

    @Override
    public ScopedConnection acquire() {
        if (closed.get()) {
            throw new IllegalStateException("Connection pool is closed");
        }
        StatefulRedisConnection<String, byte[]> connection = borrow();
        return new RedisStoreConnection(connection.sync(), broken -> release(connection, broken));
    }

    private StatefulRedisConnection<String, byte[]> borrow() {
        try {
            return pool.borrowObject();
        } catch (NoSuchElementException e) {
            log.warn("Redis pool exhausted: active={}, maxWait={}", pool.getNumActive(), maxWait);
            throw new PoolExhaustedException("No Redis connection available within " + maxWait, e);
        } catch (IllegalStateException e) {
            throw e;
        } catch (Exception e) {
            throw new StoreException("Failed to obtain a Redis connection: " + e.getMessage(), e);
        }
    }

    private void release(StatefulRedisConnection<String, byte[]> connection, boolean broken) {
        try {
            if (broken) {
                log.warn("Discarding broken Redis connection");
                pool.invalidateObject(connection);
            } else {
                pool.returnObject(connection);
            }
        } catch (Exception e) {
            log.warn("Failed to release Redis connection: {}", e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                pool.close();
            } finally {
                onClose.run();
            }
            log.info("Redis connection pool closed");
        }
    }
}
