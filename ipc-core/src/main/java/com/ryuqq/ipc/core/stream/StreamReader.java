package com.ryuqq.ipc.core.stream;

import com.ryuqq.ipc.core.model.StreamCursor;
import com.ryuqq.ipc.core.model.StreamEvent;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Cursor를 보관하며 event stream을 순서대로 읽는 reader.
 *
 * <p>첫 read에서 {@link StartPosition}으로 cursor를 정하고, event를 읽을 때마다 그 event의
 * cursor로 전진합니다. cursor는 메모리에만 있으며 저장되지 않습니다.</p>
 *
 * <p><strong>만료 처리:</strong> read가 {@link com.ryuqq.ipc.core.error.CursorExpiredException}을
 * 던지면 cursor는 그대로 남습니다. {@link #resync()}를 호출해 보존 중인 가장 오래된 entry부터
 * 다시 읽을 수 있으며, 그 사이의 유실은 반환된 cursor로 드러납니다.</p>
 *
 * <p><strong>동시성:</strong> thread-safe 아님. reader 하나는 한 thread에서만 사용합니다.</p>
 *
 * @param <T> event 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StreamReader<T> {

    private final EventStream<T> stream;
    private final StartPosition startPosition;
    private StreamCursor cursor;

    StreamReader(EventStream<T> stream, StartPosition startPosition) {
        this.stream = stream;
        this.startPosition = startPosition;
    }

    /**
     * 다음 event 1개를 non-blocking으로 읽음.
     *
     * @return event, 새 entry가 없으면 empty
     */
    public Optional<StreamEvent<T>> next() {
        Optional<StreamEvent<T>> event = stream.readOne(position());
        event.ifPresent(this::advance);
        return event;
    }

    public StreamEvent<T> nextBlocking() {
        return nextBlocking(stream.config().readTimeout());
    }

    /**
     * 다음 event를 기다림.
     *
     * @param timeout 최대 대기 시간 (null 또는 0이면 1회 read)
     * @return event
     * @throws com.ryuqq.ipc.core.error.IpcTimeoutException timeout 내에 entry가 없는 경우
     */
    public StreamEvent<T> nextBlocking(Duration timeout) {
        StreamEvent<T> event = stream.readNextBlocking(position(), timeout);
        advance(event);
        return event;
    }

    /**
     * 현재 읽을 수 있는 event를 모두 읽음.
     *
     * <p>도중에 decode 오류가 나면 그 직전 event까지 cursor가 전진한 상태로 예외를 던집니다.</p>
     *
     * @return event 목록 (비어 있을 수 있음)
     */
    public List<StreamEvent<T>> poll() {
        List<StreamEvent<T>> events = new ArrayList<>();
        try (Stream<StreamEvent<T>> available = stream.readFrom(position())) {
            Iterator<StreamEvent<T>> iterator = available.iterator();
            while (iterator.hasNext()) {
                StreamEvent<T> event = iterator.next();
                advance(event);
                events.add(event);
            }
        }
        return events;
    }

    /**
     * @return 현재 cursor, 아직 첫 read 전이면 empty
     */
    public Optional<StreamCursor> cursor() {
        return Optional.ofNullable(cursor);
    }

    public void seek(StreamCursor cursor) {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
        this.cursor = cursor;
    }

    /**
     * 보존 중인 가장 오래된 entry 앞으로 cursor를 옮김.
     *
     * @return 버려진 cursor (첫 read 전이었다면 {@link StreamCursor#beginning()})
     */
    public StreamCursor resync() {
        StreamCursor abandoned = cursor == null ? StreamCursor.beginning() : cursor;
        cursor = StreamCursor.beginning();
        return abandoned;
    }

    private StreamCursor position() {
        if (cursor == null) {
            cursor = startPosition == StartPosition.LATEST
                ? stream.lastCursor().orElse(StreamCursor.beginning())
                : StreamCursor.beginning();
        }
        return cursor;
    }

    private void advance(StreamEvent<T> event) {
        cursor = event.cursor();
    }
}
