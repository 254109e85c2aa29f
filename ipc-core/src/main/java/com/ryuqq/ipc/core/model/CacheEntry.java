package com.ryuqq.ipc.core.model;

import java.time.Instant;

/**
 * Cache에 저장된 값과 그 값이 기록된 시각.
 *
 * @param content 역직렬화된 값
 * @param writtenAt 값을 기록한 writer 측 시각
 * @param <T> 값 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record CacheEntry<T>(T content, Instant writtenAt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException writtenAt이 null인 경우
     */
    public CacheEntry {
        if (writtenAt == null) {
            throw new IllegalArgumentException("writtenAt cannot be null");
        }
    }
}
