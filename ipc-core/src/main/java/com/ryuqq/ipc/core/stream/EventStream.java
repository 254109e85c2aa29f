package com.ryuqq.ipc.core.stream;

import com.ryuqq.ipc.core.codec.Codecs;
import com.ryuqq.ipc.core.error.CursorExpiredException;
import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.model.StreamCursor;
import com.ryuqq.ipc.core.model.StreamEvent;
import com.ryuqq.ipc.core.poll.BlockingPoller;
import com.ryuqq.ipc.core.poll.PollingConfig;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.PayloadCodec;
import com.ryuqq.ipc.core.spi.StoreConnection;
import com.ryuqq.ipc.core.spi.StreamRecord;

import java.time.Duration;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 크기가 제한된 append-only event stream.
 *
 * <p>EventStream 자체는 상태가 없습니다. 읽기 위치(cursor)는 호출자가 넘기거나
 * {@link #reader()}가 돌려주는 {@link StreamReader}가 보관합니다.</p>
 *
 * <p><strong>쓰기:</strong> append와 trim은 저장소에서 원자적으로 수행되며, 가장 오래된
 * entry부터 정확히 maxSize개가 남을 때까지 제거합니다. 서로 다른 maxSize로 append하는
 * writer가 섞이면 각 append가 자기 maxSize로 trim합니다.</p>
 *
 * <p><strong>읽기:</strong></p>
 * <ul>
 *   <li>{@link #readFrom}: non-blocking, lazy, 호출 시점의 마지막 entry까지만 읽는 유한 stream.
 *       page마다 커넥션을 한 번 빌림</li>
 *   <li>{@link #readNextBlocking}: cursor 다음 entry를 기다림. 저장소 native blocking read를
 *       slice 단위로 나눠 호출</li>
 * </ul>
 *
 * <p><strong>만료된 cursor:</strong> {@link StreamCursor#beginning()}이 아닌 cursor가 보존 중인
 * 첫 entry보다 앞에 있으면 (해당 entry가 trim된 경우, stream이 비었거나 삭제된 경우 포함)
 * {@link CursorExpiredException}을 던집니다. 판정은 range read 직후 같은 커넥션에서 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * EventStream&lt;String&gt; events = new EventStream&lt;&gt;(pool, StreamConfig.of("audit", 1000), codec);
 * StreamCursor cursor = events.append("created");
 *
 * try (Stream&lt;StreamEvent&lt;String&gt;&gt; page = events.readFrom(StreamCursor.beginning())) {
 *     page.forEach(event -&gt; handle(event.content()));
 * }
 * </pre>
 *
 * @param <T> event 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class EventStream<T> {

    private final ConnectionPool pool;
    private final StreamConfig config;
    private final PayloadCodec<T> codec;
    private final PollingConfig polling;
    private final BlockingPoller poller;

    public EventStream(ConnectionPool pool, StreamConfig config, PayloadCodec<T> codec) {
        this(pool, config, codec, new PollingConfig());
    }

    public EventStream(ConnectionPool pool, StreamConfig config, PayloadCodec<T> codec, PollingConfig polling) {
        this(pool, config, codec, polling, new BlockingPoller(polling));
    }

    public EventStream(ConnectionPool pool,
                       StreamConfig config,
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
    }

    /**
     * 설정된 maxSize로 append.
     *
     * @param event event
     * @return 새 entry의 cursor
     */
    public StreamCursor append(T event) {
        return append(event, config.maxSize());
    }

    /**
     * Append 후 stream을 maxSize개로 trim (원자적).
     *
     * @param event event
     * @param maxSize 최대 보존 entry 수 (1 이상)
     * @return 새 entry의 cursor
     * @throws IllegalArgumentException maxSize가 1 미만인 경우
     * @throws com.ryuqq.ipc.core.error.SerializationException 직렬화 실패 시
     */
    public StreamCursor append(T event, long maxSize) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1 (current: " + maxSize + ")");
        }
        byte[] payload = Codecs.encode(codec, event);
        String key = key();
        return pool.execute(connection -> connection.append(key, payload, maxSize));
    }

    /**
     * cursor 이후의 entry를 순서대로 읽음 (non-blocking).
     *
     * <p>반환된 stream은 호출 시점의 마지막 entry에서 끝납니다. 첫 page는 호출 시점에
     * 읽고, 이후 page는 소비할 때 읽습니다. 반환된 어떤 event의 cursor에서든 다시 시작할 수
     * 있습니다.</p>
     *
     * @param cursor 이 cursor 다음부터 읽음
     * @return event stream (비어 있을 수 있음)
     * @throws CursorExpiredException cursor가 만료된 경우
     */
    public Stream<StreamEvent<T>> readFrom(StreamCursor cursor) {
        requireCursor(cursor);
        String key = key();
        int pageSize = config.pageSize();
        PageIterator iterator = pool.execute(connection -> {
            Optional<StreamCursor> until = connection.last(key).map(StreamRecord::id);
            List<StreamRecord> records = until.isPresent()
                ? connection.rangeAfter(key, cursor, until.get(), pageSize)
                : List.of();
            verifyRetained(connection, cursor);
            return new PageIterator(cursor, until.orElse(null), records);
        });
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    /**
     * 설정된 readTimeout 동안 cursor 다음 entry를 기다림.
     *
     * @param cursor 이 cursor 다음 entry를 읽음
     * @return event
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 entry가 없는 경우
     */
    public StreamEvent<T> readNextBlocking(StreamCursor cursor) {
        return readNextBlocking(cursor, config.readTimeout());
    }

    /**
     * 지정한 timeout 동안 cursor 다음 entry를 기다림.
     *
     * @param cursor 이 cursor 다음 entry를 읽음
     * @param timeout 최대 대기 시간 (null 또는 0이면 1회 read)
     * @return event
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 entry가 없는 경우
     * @throws CursorExpiredException cursor가 만료된 경우
     */
    public StreamEvent<T> readNextBlocking(StreamCursor cursor, Duration timeout) {
        requireCursor(cursor);
        String key = key();
        StreamRecord record = poller.blockUntil(
            timeout,
            polling.nativeBlockSlice(),
            wait -> pool.execute(connection -> {
                Optional<StreamRecord> found = connection.readAfterBlocking(key, cursor, wait);
                verifyRetained(connection, cursor);
                return found;
            }),
            () -> readOneRecord(cursor));
        return toEvent(record);
    }

    /**
     * @return 가장 최근 entry, stream이 비어 있으면 empty
     */
    public Optional<StreamEvent<T>> last() {
        String key = key();
        return pool.execute(connection -> connection.last(key)).map(this::toEvent);
    }

    public long length() {
        String key = key();
        return pool.execute(connection -> connection.streamLength(key));
    }

    /**
     * 설정된 {@link StreamConfig#startPosition()}에서 시작하는 reader 생성.
     *
     * @return 새 reader (thread-safe 아님)
     */
    public StreamReader<T> reader() {
        return new StreamReader<>(this, config.startPosition());
    }

    public ChannelName name() {
        return config.name();
    }

    StreamConfig config() {
        return config;
    }

    Optional<StreamEvent<T>> readOne(StreamCursor cursor) {
        requireCursor(cursor);
        return readOneRecord(cursor).map(this::toEvent);
    }

    Optional<StreamCursor> lastCursor() {
        String key = key();
        return pool.execute(connection -> connection.last(key)).map(StreamRecord::id);
    }

    private Optional<StreamRecord> readOneRecord(StreamCursor cursor) {
        String key = key();
        return pool.execute(connection -> {
            List<StreamRecord> records = connection.rangeAfter(key, cursor, null, 1);
            verifyRetained(connection, cursor);
            return records.stream().findFirst();
        });
    }

    private void verifyRetained(StoreConnection connection, StreamCursor cursor) {
        if (cursor.isBeginning()) {
            return;
        }
        Optional<StreamCursor> first = connection.firstId(key());
        if (first.isEmpty() || cursor.isBefore(first.get())) {
            throw new CursorExpiredException(key(), cursor, first.orElse(null));
        }
    }

    private StreamEvent<T> toEvent(StreamRecord record) {
        try {
            return new StreamEvent<>(record.id(), Codecs.decode(codec, record.payload()));
        } catch (DecodeException e) {
            throw new DecodeException(
                "Stream " + key() + " entry " + record.id().getValue() + ": " + e.getMessage(), e);
        }
    }

    private String key() {
        return config.name().getValue();
    }

    private static void requireCursor(StreamCursor cursor) {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
    }

    /**
     * readFrom 결과를 page 단위로 읽어 오는 iterator.
     */
    private final class PageIterator implements Iterator<StreamEvent<T>> {

        private final StreamCursor until;
        private Iterator<StreamRecord> page;
        private StreamCursor position;
        private boolean lastPage;

        PageIterator(StreamCursor from, StreamCursor until, List<StreamRecord> firstPage) {
            this.until = until;
            this.position = from;
            this.page = firstPage.iterator();
            this.lastPage = until == null || firstPage.size() < config.pageSize();
        }

        @Override
        public boolean hasNext() {
            while (!page.hasNext() && !lastPage) {
                fetchNextPage();
            }
            return page.hasNext();
        }

        @Override
        public StreamEvent<T> next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            StreamRecord record = page.next();
            position = record.id();
            if (position.compareTo(until) >= 0) {
                lastPage = true;
            }
            return toEvent(record);
        }

        private void fetchNextPage() {
            String key = key();
            StreamCursor after = position;
            int pageSize = config.pageSize();
            List<StreamRecord> records = pool.execute(connection -> {
                List<StreamRecord> found = connection.rangeAfter(key, after, until, pageSize);
                verifyRetained(connection, after);
                return found;
            });
            page = records.iterator();
            lastPage = records.size() < pageSize;
        }
    }
}
