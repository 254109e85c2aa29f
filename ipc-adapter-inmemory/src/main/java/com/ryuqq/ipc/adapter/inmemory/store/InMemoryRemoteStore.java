package com.ryuqq.ipc.adapter.inmemory.store;

import com.ryuqq.ipc.core.error.IpcErrorKind;
import com.ryuqq.ipc.core.error.IpcException;
import com.ryuqq.ipc.core.error.StoreException;
import com.ryuqq.ipc.core.model.StreamCursor;
import com.ryuqq.ipc.core.spi.StoreConnection;
import com.ryuqq.ipc.core.spi.StreamRecord;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;

/**
 * In-memory implementation of the remote store for testing and reference purposes.
 *
 * <p>This class plays the role Redis plays in production: a shared key/value, list and stream
 * store that every primitive talks to through pooled connections. All state lives behind one
 * {@link ReentrantLock}, which makes every command atomic the way a single-threaded Redis
 * server does.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>values:</strong> HashMap&lt;String, ValueEntry&gt; - key/value with optional expiry</li>
 *   <li><strong>lists:</strong> HashMap&lt;String, ArrayDeque&lt;byte[]&gt;&gt; - FIFO lists (push tail, pop head)</li>
 *   <li><strong>streams:</strong> HashMap&lt;String, StreamLog&gt; - append-only logs with {@code ms-seq} ids</li>
 * </ul>
 *
 * <p><strong>Redis Semantics Reproduced:</strong></p>
 * <ul>
 *   <li>Expiry is evaluated lazily against an injectable millisecond clock (SET PX)</li>
 *   <li>Empty lists and streams emptied by trimming keep no key (LPOP on last element)</li>
 *   <li>Stream ids are {@code <millis>-<seq>} and strictly increase even if the clock stalls (XADD)</li>
 *   <li>Append and trim are one atomic step (XADD MAXLEN n)</li>
 *   <li>Blocking pops wake up as soon as an element arrives (BLPOP, XREAD BLOCK)</li>
 * </ul>
 *
 * <p><strong>Fault Injection:</strong> {@link #setAvailable(boolean)} makes every command fail
 * with {@link StoreException}, simulating a lost server.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Keys of different types live in separate namespaces (no WRONGTYPE errors)</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryRemoteStore implements StoreConnection {

    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Signalled whenever a list element or stream entry is added.
     */
    private final Condition dataAdded = lock.newCondition();

    private final Map<String, ValueEntry> values = new HashMap<>();
    private final Map<String, Deque<byte[]>> lists = new HashMap<>();
    private final Map<String, StreamLog> streams = new HashMap<>();

    /**
     * Millisecond wall clock used for expiry and stream ids.
     */
    private final LongSupplier clock;

    private volatile boolean available = true;

    /**
     * Creates a store driven by the system clock.
     */
    public InMemoryRemoteStore() {
        this(System::currentTimeMillis);
    }

    /**
     * Creates a store driven by a custom millisecond clock (deterministic TTL tests).
     *
     * @param clock epoch millisecond supplier
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryRemoteStore(LongSupplier clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    // ---------------------------------------------------------------- key/value

    @Override
    public Optional<byte[]> get(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            ValueEntry entry = liveValue(key);
            return entry == null ? Optional.empty() : Optional.of(entry.value.clone());
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Replaces both value and expiry (SET key value PX ttl)</li>
     *   <li>ttl null or zero: no expiry (plain SET)</li>
     * </ul>
     */
    @Override
    public void set(String key, byte[] value, Duration ttl) {
        requireKey(key);
        requireValue(value);
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative, but was: " + ttl);
        }
        lock.lock();
        try {
            ensureAvailable();
            long expiresAt = ttl == null || ttl.isZero() ? -1L : clock.getAsLong() + ttl.toMillis();
            values.put(key, new ValueEntry(value.clone(), expiresAt));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            boolean removed = liveValue(key) != null;
            values.remove(key);
            removed |= lists.remove(key) != null;
            removed |= streams.remove(key) != null;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean exists(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            return liveValue(key) != null || lists.containsKey(key) || streams.containsKey(key);
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- list

    @Override
    public void pushTail(String key, byte[] value) {
        requireKey(key);
        requireValue(value);
        lock.lock();
        try {
            ensureAvailable();
            lists.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(value.clone());
            dataAdded.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<byte[]> popHead(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            return Optional.ofNullable(pollHead(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Waits on a lock condition, so the wait consumes no CPU</li>
     *   <li>Interruption restores the interrupt flag and fails with kind INTERRUPTED</li>
     * </ul>
     */
    @Override
    public Optional<byte[]> popHeadBlocking(String key, Duration timeout) {
        requireKey(key);
        requirePositive(timeout);
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                ensureAvailable();
                byte[] head = pollHead(key);
                if (head != null) {
                    return Optional.of(head);
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = dataAdded.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IpcException(IpcErrorKind.INTERRUPTED, "Interrupted during blocking pop on " + key, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Scans from the head under the store lock and removes the first non-matching element</li>
     *   <li>Skipped elements keep their position</li>
     * </ul>
     */
    @Override
    public Optional<byte[]> popHeadExcluding(String key, byte[] excludedPrefix) {
        requireKey(key);
        if (excludedPrefix == null) {
            throw new IllegalArgumentException("excludedPrefix cannot be null");
        }
        lock.lock();
        try {
            ensureAvailable();
            Deque<byte[]> list = lists.get(key);
            if (list == null) {
                return Optional.empty();
            }
            Iterator<byte[]> iterator = list.iterator();
            while (iterator.hasNext()) {
                byte[] element = iterator.next();
                if (!startsWith(element, excludedPrefix)) {
                    iterator.remove();
                    if (list.isEmpty()) {
                        lists.remove(key);
                    }
                    return Optional.of(element);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long listLength(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            Deque<byte[]> list = lists.get(key);
            return list == null ? 0L : list.size();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- stream

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>id = {@code now-0}, or {@code last.millis-(last.seq + 1)} when the clock did not move forward</li>
     *   <li>Oldest entries are removed until exactly maxSize remain</li>
     * </ul>
     */
    @Override
    public StreamCursor append(String key, byte[] value, long maxSize) {
        requireKey(key);
        requireValue(value);
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, but was: " + maxSize);
        }
        lock.lock();
        try {
            ensureAvailable();
            StreamLog log = streams.computeIfAbsent(key, k -> new StreamLog());
            StreamCursor id = log.nextId(clock.getAsLong());
            log.entries.addLast(new StreamRecord(id, value.clone()));
            while (log.entries.size() > maxSize) {
                log.entries.removeFirst();
            }
            dataAdded.signalAll();
            return id;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<StreamRecord> rangeAfter(String key, StreamCursor after, StreamCursor until, int limit) {
        requireKey(key);
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, but was: " + limit);
        }
        lock.lock();
        try {
            ensureAvailable();
            StreamLog log = streams.get(key);
            if (log == null) {
                return List.of();
            }
            List<StreamRecord> result = new ArrayList<>();
            for (StreamRecord record : log.entries) {
                if (result.size() >= limit || (until != null && until.isBefore(record.id()))) {
                    break;
                }
                if (after.isBefore(record.id())) {
                    result.add(copy(record));
                }
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StreamCursor> firstId(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            StreamLog log = streams.get(key);
            return log == null || log.entries.isEmpty()
                ? Optional.empty()
                : Optional.of(log.entries.peekFirst().id());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StreamRecord> last(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            StreamLog log = streams.get(key);
            return log == null || log.entries.isEmpty()
                ? Optional.empty()
                : Optional.of(copy(log.entries.peekLast()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<StreamRecord> readAfterBlocking(String key, StreamCursor after, Duration timeout) {
        requireKey(key);
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        requirePositive(timeout);
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (true) {
                List<StreamRecord> next = rangeAfter(key, after, null, 1);
                if (!next.isEmpty()) {
                    return Optional.of(next.get(0));
                }
                if (remaining <= 0) {
                    return Optional.empty();
                }
                remaining = dataAdded.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IpcException(IpcErrorKind.INTERRUPTED, "Interrupted during blocking read on " + key, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long streamLength(String key) {
        requireKey(key);
        lock.lock();
        try {
            ensureAvailable();
            StreamLog log = streams.get(key);
            return log == null ? 0L : log.entries.size();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- test support

    /**
     * Switches the simulated server on or off. While unavailable every command fails with
     * {@link StoreException}.
     *
     * @param available false to simulate an outage
     */
    public void setAvailable(boolean available) {
        this.available = available;
    }

    public boolean isAvailable() {
        return available;
    }

    /**
     * Removes every key. Used for test cleanup.
     */
    public void clear() {
        lock.lock();
        try {
            values.clear();
            lists.clear();
            streams.clear();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------- internals

    private ValueEntry liveValue(String key) {
        ValueEntry entry = values.get(key);
        if (entry != null && entry.isExpired(clock.getAsLong())) {
            values.remove(key);
            return null;
        }
        return entry;
    }

    private byte[] pollHead(String key) {
        Deque<byte[]> list = lists.get(key);
        if (list == null) {
            return null;
        }
        byte[] head = list.pollFirst();
        if (list.isEmpty()) {
            lists.remove(key);
        }
        return head;
    }

    private void ensureAvailable() {
        if (!available) {
            throw new StoreException("In-memory store is unavailable");
        }
    }

    private static boolean startsWith(byte[] element, byte[] prefix) {
        return element.length >= prefix.length
            && Arrays.equals(element, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static StreamRecord copy(StreamRecord record) {
        return new StreamRecord(record.id(), record.payload().clone());
    }

    private static void requireKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("key cannot be null or empty");
        }
    }

    private static void requireValue(byte[] value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
    }

    private static void requirePositive(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, but was: " + timeout);
        }
    }

    /**
     * Stored value with its absolute expiry (-1 = never).
     */
    private static final class ValueEntry {
        private final byte[] value;
        private final long expiresAtMillis;

        ValueEntry(byte[] value, long expiresAtMillis) {
            this.value = value;
            this.expiresAtMillis = expiresAtMillis;
        }

        boolean isExpired(long nowMillis) {
            return expiresAtMillis >= 0 && nowMillis >= expiresAtMillis;
        }
    }

    /**
     * Entries of one stream plus the last id handed out. Starts at 0-0, so the first id is never
     * {@link StreamCursor#beginning()}.
     */
    private static final class StreamLog {
        private final Deque<StreamRecord> entries = new ArrayDeque<>();
        private long lastMillis;
        private long lastSequence;

        StreamCursor nextId(long nowMillis) {
            if (nowMillis > lastMillis) {
                lastMillis = nowMillis;
                lastSequence = 0L;
            } else {
                lastSequence++;
            }
            return StreamCursor.of(lastMillis + "-" + lastSequence);
        }
    }
}
