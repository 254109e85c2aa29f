package com.ryuqq.ipc.adapter.inmemory.pool;

import com.ryuqq.ipc.adapter.inmemory.store.InMemoryRemoteStore;
import com.ryuqq.ipc.core.error.IpcErrorKind;
import com.ryuqq.ipc.core.error.IpcException;
import com.ryuqq.ipc.core.error.PoolExhaustedException;
import com.ryuqq.ipc.core.error.StoreException;
import com.ryuqq.ipc.core.model.StreamCursor;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.ScopedConnection;
import com.ryuqq.ipc.core.spi.StreamRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded connection pool over an {@link InMemoryRemoteStore}.
 *
 * <p>Behaves like a real client pool from the caller's point of view: a fixed number of
 * connections, a bounded wait for a free one, and a health check on every borrow. It also
 * records how many connections are in use so tests can assert that no primitive holds a
 * connection while it sleeps.</p>
 *
 * <p><strong>Borrow Rules:</strong></p>
 * <ul>
 *   <li>At most {@code maxConnections} handles are open at a time (semaphore permits)</li>
 *   <li>{@link #acquire()} waits at most {@code maxWait}, then fails with {@link PoolExhaustedException}</li>
 *   <li>An unavailable store fails the health check with {@link StoreException}</li>
 *   <li>Closing a handle returns its permit; closing twice is a no-op</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryRemoteStore store = new InMemoryRemoteStore();
 * try (ConnectionPool pool = new InMemoryConnectionPool(store, 8, Duration.ofSeconds(1))) {
 *     Cache&lt;String&gt; cache = new Cache&lt;&gt;(pool, CacheConfig.of("sessions"), Utf8StringCodec.instance());
 *     cache.set("u1", "token");
 * }
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryConnectionPool implements ConnectionPool {

    private static final Logger log = LoggerFactory.getLogger(InMemoryConnectionPool.class);

    public static final int DEFAULT_MAX_CONNECTIONS = 8;
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(1);

    private final InMemoryRemoteStore store;
    private final int maxConnections;
    private final Duration maxWait;
    private final Semaphore permits;
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger peakActive = new AtomicInteger();
    private final AtomicInteger borrowCount = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * Creates a pool with default limits (8 connections, 1 second wait).
     *
     * @param store backing store
     */
    public InMemoryConnectionPool(InMemoryRemoteStore store) {
        this(store, DEFAULT_MAX_CONNECTIONS, DEFAULT_MAX_WAIT);
    }

    /**
     * @param store backing store
     * @param maxConnections maximum open handles (at least 1)
     * @param maxWait maximum time {@link #acquire()} waits for a free handle (zero = fail fast)
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public InMemoryConnectionPool(InMemoryRemoteStore store, int maxConnections, Duration maxWait) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (maxConnections < 1) {
            throw new IllegalArgumentException("maxConnections must be at least 1, but was: " + maxConnections);
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be null or negative, but was: " + maxWait);
        }
        this.store = store;
        this.maxConnections = maxConnections;
        this.maxWait = maxWait;
        this.permits = new Semaphore(maxConnections, true);
    }

    @Override
    public ScopedConnection acquire() {
        if (closed.get()) {
            throw new IllegalStateException("Connection pool is closed");
        }
        boolean acquired;
        try {
            acquired = permits.tryAcquire(maxWait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IpcException(IpcErrorKind.INTERRUPTED, "Interrupted while waiting for a connection", e);
        }
        if (!acquired) {
            log.warn("In-memory pool exhausted: maxConnections={}, maxWait={}", maxConnections, maxWait);
            throw new PoolExhaustedException(
                "No connection available within " + maxWait + " (max " + maxConnections + ")");
        }
        if (!store.isAvailable()) {
            permits.release();
            throw new StoreException("Health check failed: in-memory store is unavailable");
        }
        int now = active.incrementAndGet();
        peakActive.accumulateAndGet(now, Math::max);
        borrowCount.incrementAndGet();
        return new PooledConnection();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("In-memory pool closed: active={}, borrowed={}", active.get(), borrowCount.get());
        }
    }

    /**
     * @return handles currently borrowed and not yet closed
     */
    public int activeConnections() {
        return active.get();
    }

    /**
     * @return highest number of handles open at the same time since creation or the last reset
     */
    public int peakActiveConnections() {
        return peakActive.get();
    }

    /**
     * @return total number of successful {@link #acquire()} calls
     */
    public int borrowCount() {
        return borrowCount.get();
    }

    public void resetStatistics() {
        peakActive.set(active.get());
        borrowCount.set(0);
    }

    public InMemoryRemoteStore store() {
        return store;
    }

    /**
     * Handle delegating to the shared store until closed.
     */
    private final class PooledConnection implements ScopedConnection {

        private final AtomicBoolean released = new AtomicBoolean();

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                active.decrementAndGet();
                permits.release();
            }
        }

        private InMemoryRemoteStore target() {
            if (released.get()) {
                throw new IllegalStateException("Connection already returned to the pool");
            }
            return store;
        }

        @Override
        public Optional<byte[]> get(String key) {
            return target().get(key);
        }

        @Override
        public void set(String key, byte[] value, Duration ttl) {
            target().set(key, value, ttl);
        }

        @Override
        public boolean delete(String key) {
            return target().delete(key);
        }

        @Override
        public boolean exists(String key) {
            return target().exists(key);
        }

        @Override
        public void pushTail(String key, byte[] value) {
            target().pushTail(key, value);
        }

        @Override
        public Optional<byte[]> popHead(String key) {
            return target().popHead(key);
        }

        @Override
        public Optional<byte[]> popHeadBlocking(String key, Duration timeout) {
            return target().popHeadBlocking(key, timeout);
        }

        @Override
        public Optional<byte[]> popHeadExcluding(String key, byte[] excludedPrefix) {
            return target().popHeadExcluding(key, excludedPrefix);
        }

        @Override
        public long listLength(String key) {
            return target().listLength(key);
        }

        @Override
        public StreamCursor append(String key, byte[] value, long maxSize) {
            return target().append(key, value, maxSize);
        }

        @Override
        public List<StreamRecord> rangeAfter(String key, StreamCursor after, StreamCursor until, int limit) {
            return target().rangeAfter(key, after, until, limit);
        }

        @Override
        public Optional<StreamCursor> firstId(String key) {
            return target().firstId(key);
        }

        @Override
        public Optional<StreamRecord> last(String key) {
            return target().last(key);
        }

        @Override
        public Optional<StreamRecord> readAfterBlocking(String key, StreamCursor after, Duration timeout) {
            return target().readAfterBlocking(key, after, timeout);
        }

        @Override
        public long streamLength(String key) {
            return target().streamLength(key);
        }
    }
}
