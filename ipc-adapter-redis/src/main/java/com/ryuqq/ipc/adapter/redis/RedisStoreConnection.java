package com.ryuqq.ipc.adapter.redis;

import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.error.StoreException;
import com.ryuqq.ipc.core.model.StreamCursor;
import com.ryuqq.ipc.core.spi.ScopedConnection;
import com.ryuqq.ipc.core.spi.StreamRecord;
import io.lettuce.core.KeyValue;
import io.lettuce.core.Limit;
import io.lettuce.core.Range;
import io.lettuce.core.RedisCommandTimeoutException;
import io.lettuce.core.RedisConnectionException;
import io.lettuce.core.RedisException;
import io.lettuce.core.ScriptOutputType;
import io.lettuce.core.SetArgs;
import io.lettuce.core.StreamMessage;
import io.lettuce.core.XAddArgs;
import io.lettuce.core.XReadArgs;
import io.lettuce.core.api.sync.RedisCommands;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * {@link ScopedConnection} backed by one pooled Lettuce connection.
 *
 * <p>Each {@link com.ryuqq.ipc.core.spi.StoreConnection} method maps to one Redis command,
 * except {@link #popHeadExcluding} which runs a Lua script so that scan and removal happen
 * atomically on the server.</p>
 *
 * <p><strong>Command Mapping:</strong></p>
 * <ul>
 *   <li>get / set / delete / exists: GET, SET [PX], DEL, EXISTS</li>
 *   <li>pushTail / popHead / popHeadBlocking / listLength: RPUSH, LPOP, BLPOP, LLEN</li>
 *   <li>append: XADD key MAXLEN = n * payload value</li>
 *   <li>rangeAfter / firstId / last: XRANGE (exclusive start), XRANGE - + COUNT 1, XREVRANGE + - COUNT 1</li>
 *   <li>readAfterBlocking / streamLength: XREAD BLOCK ms COUNT 1, XLEN</li>
 * </ul>
 *
 * <p><strong>Error Mapping:</strong> every Lettuce {@link RedisException} becomes a
 * {@link StoreException}. Connection failures and command timeouts also mark the connection as
 * broken, so the pool discards it instead of handing it out again.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RedisStoreConnection implements ScopedConnection {

    /**
     * Stream entry field holding the encoded payload.
     */
    static final String PAYLOAD_FIELD = "payload";

    /**
     * Removes and returns the first element of KEYS[1] that does not start with ARGV[1].
     * LREM count 1 removes the right element: every earlier element starts with the prefix,
     * so none of them can be equal to it.
     */
    static final String POP_EXCLUDING_SCRIPT = String.join("\n",
        "local prefix = ARGV[1]",
        "local n = string.len(prefix)",
        "local len = redis.call('LLEN', KEYS[1])",
        "local i = 0",
        "while i < len do",
        "  local items = redis.call('LRANGE', KEYS[1], i, i + 99)",
        "  for _, item in ipairs(items) do",
        "    if string.sub(item, 1, n) ~= prefix then",
        "      redis.call('LREM', KEYS[1], 1, item)",
        "      return item",
        "    end",
        "  end",
        "  i = i + 100",
        "end",
        "return false");

    /**
     * Called once when the handle is closed.
     */
    @FunctionalInterface
    interface ReleaseCallback {
        void release(boolean broken);
    }

    private final RedisCommands<String, byte[]> commands;
    private final ReleaseCallback releaseCallback;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile boolean broken;

    RedisStoreConnection(RedisCommands<String, byte[]> commands, ReleaseCallback releaseCallback) {
        this.commands = commands;
        this.releaseCallback = releaseCallback;
    }

    // ---------------------------------------------------------------- key/value

    @Override
    public Optional<byte[]> get(String key) {
        return call("GET", () -> Optional.ofNullable(commands.get(key)));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        if (ttl != null && ttl.isNegative()) {
            throw new IllegalArgumentException("ttl cannot be negative, but was: " + ttl);
        }
        call("SET", () -> {
            if (ttl == null || ttl.isZero()) {
                return commands.set(key, value);
            }
            return commands.set(key, value, SetArgs.Builder.px(Math.max(1L, ttl.toMillis())));
        });
    }

    @Override
    public boolean delete(String key) {
        return call("DEL", () -> commands.del(key)) > 0;
    }

    @Override
    public boolean exists(String key) {
        return call("EXISTS", () -> commands.exists(key)) > 0;
    }

    // ---------------------------------------------------------------- list

    @Override
    public void pushTail(String key, byte[] value) {
        call("RPUSH", () -> commands.rpush(key, value));
    }

    @Override
    public Optional<byte[]> popHead(String key) {
        return call("LPOP", () -> Optional.ofNullable(commands.lpop(key)));
    }

    @Override
    public Optional<byte[]> popHeadBlocking(String key, Duration timeout) {
        requirePositive(timeout);
        double seconds = timeout.toMillis() / 1000.0;
        KeyValue<String, byte[]> popped = call("BLPOP", () -> commands.blpop(seconds, key));
        if (popped == null || !popped.hasValue()) {
            return Optional.empty();
        }
        return Optional.of(popped.getValue());
    }

    @Override
    public Optional<byte[]> popHeadExcluding(String key, byte[] excludedPrefix) {
        if (excludedPrefix == null) {
            throw new IllegalArgumentException("excludedPrefix cannot be null");
        }
        byte[] popped = call("EVAL", () -> commands.<byte[]>eval(
            POP_EXCLUDING_SCRIPT, ScriptOutputType.VALUE, new String[]{key}, excludedPrefix));
        return Optional.ofNullable(popped);
    }

    @Override
    public long listLength(String key) {
        return call("LLEN", () -> commands.llen(key));
    }

    // ---------------------------------------------------------------- stream

    @Override
    public StreamCursor append(String key, byte[] value, long maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1, but was: " + maxSize);
        }
        String id = call("XADD", () -> commands.xadd(
            key, XAddArgs.Builder.maxlen(maxSize).exactTrimming(), Map.of(PAYLOAD_FIELD, value)));
        return StreamCursor.of(id);
    }

    @Override
    public List<StreamRecord> rangeAfter(String key, StreamCursor after, StreamCursor until, int limit) {
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1, but was: " + limit);
        }
        Range<String> range = Range.from(
            Range.Boundary.excluding(after.getValue()),
            until == null ? Range.Boundary.unbounded() : Range.Boundary.including(until.getValue()));
        return toRecords(call("XRANGE", () -> commands.xrange(key, range, Limit.from(limit))));
    }

    @Override
    public Optional<StreamCursor> firstId(String key) {
        List<StreamMessage<String, byte[]>> first =
            call("XRANGE", () -> commands.xrange(key, Range.unbounded(), Limit.from(1)));
        return first.isEmpty() ? Optional.empty() : Optional.of(StreamCursor.of(first.get(0).getId()));
    }

    @Override
    public Optional<StreamRecord> last(String key) {
        List<StreamMessage<String, byte[]>> last =
            call("XREVRANGE", () -> commands.xrevrange(key, Range.unbounded(), Limit.from(1)));
        return toRecords(last).stream().findFirst();
    }

    @Override
    public Optional<StreamRecord> readAfterBlocking(String key, StreamCursor after, Duration timeout) {
        if (after == null) {
            throw new IllegalArgumentException("after cannot be null");
        }
        requirePositive(timeout);
        List<StreamMessage<String, byte[]>> read = call("XREAD", () -> commands.xread(
            XReadArgs.Builder.block(timeout).count(1),
            XReadArgs.StreamOffset.from(key, after.getValue())));
        return toRecords(read).stream().findFirst();
    }

    @Override
    public long streamLength(String key) {
        return call("XLEN", () -> commands.xlen(key));
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Returns the connection to the pool, or discards it if a command left it broken.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            releaseCallback.release(broken);
        }
    }

    boolean isBroken() {
        return broken;
    }

    private <R> R call(String command, Supplier<R> action) {
        if (closed.get()) {
            throw new IllegalStateException("Connection already returned to the pool");
        }
        try {
            return action.get();
        } catch (RedisConnectionException | RedisCommandTimeoutException e) {
            broken = true;
            throw new StoreException("Redis " + command + " failed: " + e.getMessage(), e);
        } catch (RedisException e) {
            throw new StoreException("Redis " + command + " failed: " + e.getMessage(), e);
        }
    }

    private static List<StreamRecord> toRecords(List<StreamMessage<String, byte[]>> messages) {
        if (messages == null || messages.isEmpty()) {
            return List.of();
        }
        List<StreamRecord> records = new ArrayList<>(messages.size());
        for (StreamMessage<String, byte[]> message : messages) {
            Map<String, byte[]> body = message.getBody();
            byte[] payload = body == null ? null : body.get(PAYLOAD_FIELD);
            if (payload == null) {
                throw new DecodeException(
                    "Stream entry " + message.getId() + " has no '" + PAYLOAD_FIELD + "' field");
            }
            records.add(new StreamRecord(StreamCursor.of(message.getId()), payload));
        }
        return records;
    }

    private static void requirePositive(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive, but was: " + timeout);
        }
    }
}
