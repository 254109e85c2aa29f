package com.ryuqq.ipc.core.model;

/**
 * Event stream에서 읽은 하나의 entry.
 *
 * @param cursor 이 entry 다음부터 이어 읽기 위한 cursor (entry 자신의 id)
 * @param content 역직렬화된 event 내용
 * @param <T> event 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record StreamEvent<T>(StreamCursor cursor, T content) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException cursor가 null인 경우
     */
    public StreamEvent {
        if (cursor == null) {
            throw new IllegalArgumentException("cursor cannot be null");
        }
    }

    /**
     * Entry가 append된 시각 (epoch millis).
     *
     * @return append 시각
     */
    public long appendedAtMillis() {
        return cursor.getMillis();
    }
}
