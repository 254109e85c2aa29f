package com.ryuqq.ipc.core.stream;

import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.poll.Timeouts;

import java.time.Duration;

/**
 * Event stream 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: stream 키</li>
 *   <li>maxSize: {@link EventStream#append(Object)}가 유지하는 최대 entry 수 (1 이상)</li>
 *   <li>readTimeout: blocking read 기본 대기 시간 (null 또는 0이면 1회 read)</li>
 *   <li>startPosition: reader의 시작 위치 (기본 BEGINNING)</li>
 *   <li>pageSize: {@link EventStream#readFrom}가 한 번에 가져오는 entry 수 (기본 100)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> maxSize는 append마다 적용됩니다. 같은 stream에 서로 다른 maxSize로
 * append하는 writer가 있으면 마지막 append의 값으로 trim됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name stream 이름 (필수)
 * @param maxSize 최대 보존 entry 수 (1 이상)
 * @param readTimeout 기본 blocking read timeout (선택)
 * @param startPosition reader 시작 위치 (필수)
 * @param pageSize range read page 크기 (1 이상)
 */
public record StreamConfig(
    ChannelName name,
    long maxSize,
    Duration readTimeout,
    StartPosition startPosition,
    int pageSize
) {

    public static final int DEFAULT_PAGE_SIZE = 100;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: readTimeout 없음, startPosition=BEGINNING, pageSize=100</p>
     *
     * @param name stream 이름
     * @param maxSize 최대 보존 entry 수
     */
    public StreamConfig(ChannelName name, long maxSize) {
        this(name, maxSize, null, StartPosition.BEGINNING, DEFAULT_PAGE_SIZE);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public StreamConfig {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be at least 1 (current: " + maxSize + ")");
        }
        Timeouts.requireNonNegative("readTimeout", readTimeout);
        if (startPosition == null) {
            throw new IllegalArgumentException("startPosition cannot be null");
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("pageSize must be at least 1 (current: " + pageSize + ")");
        }
    }

    public static StreamConfig of(String name, long maxSize) {
        return new StreamConfig(ChannelName.of(name), maxSize);
    }

    public StreamConfig withMaxSize(long maxSize) {
        return new StreamConfig(name, maxSize, readTimeout, startPosition, pageSize);
    }

    public StreamConfig withReadTimeout(Duration readTimeout) {
        return new StreamConfig(name, maxSize, readTimeout, startPosition, pageSize);
    }

    public StreamConfig withStartPosition(StartPosition startPosition) {
        return new StreamConfig(name, maxSize, readTimeout, startPosition, pageSize);
    }

    public StreamConfig withPageSize(int pageSize) {
        return new StreamConfig(name, maxSize, readTimeout, startPosition, pageSize);
    }
}
