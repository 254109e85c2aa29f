package com.ryuqq.ipc.core.poll;

import java.time.Duration;

/**
 * Blocking read 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollInterval: 값이 없을 때 다음 시도까지 대기하는 간격 (기본 50ms)</li>
 *   <li>nativeBlockSlice: 저장소 native blocking 명령 한 번에 허용하는 최대 대기 (기본 1초)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>낮은 지연: pollInterval 감소 (50 → 10ms), 대신 원격 저장소 부하 증가</li>
 *   <li>커넥션 절약: nativeBlockSlice 감소, slice 사이마다 커넥션이 pool로 반환됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollInterval poll 간격 (양수여야 함)
 * @param nativeBlockSlice native blocking 명령 1회 최대 대기 (양수여야 함)
 */
public record PollingConfig(Duration pollInterval, Duration nativeBlockSlice) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollInterval=50ms, nativeBlockSlice=1s</p>
     */
    public PollingConfig() {
        this(Duration.ofMillis(50), Duration.ofSeconds(1));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public PollingConfig {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }
        if (nativeBlockSlice == null || nativeBlockSlice.toMillis() <= 0) {
            throw new IllegalArgumentException(
                "nativeBlockSlice must be at least 1ms (current: " + nativeBlockSlice + ")");
        }
    }

    public PollingConfig withPollInterval(Duration pollInterval) {
        return new PollingConfig(pollInterval, nativeBlockSlice);
    }

    public PollingConfig withNativeBlockSlice(Duration nativeBlockSlice) {
        return new PollingConfig(pollInterval, nativeBlockSlice);
    }
}
