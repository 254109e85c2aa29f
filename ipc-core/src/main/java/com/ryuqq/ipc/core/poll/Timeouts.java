package com.ryuqq.ipc.core.poll;

import java.time.Duration;

/**
 * Timeout 인자 정규화 유틸리티.
 *
 * <p>null 또는 0은 "한 번만 시도하고 대기하지 않음"을 의미합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Timeouts {

    private Timeouts() {
    }

    /**
     * @param timeout 호출자가 전달한 timeout (null 허용)
     * @return null이면 {@link Duration#ZERO}, 그 외에는 입력값
     * @throws IllegalArgumentException 음수인 경우
     */
    public static Duration normalize(Duration timeout) {
        if (timeout == null) {
            return Duration.ZERO;
        }
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative (current: " + timeout + ")");
        }
        return timeout;
    }

    /**
     * Config에 지정된 optional duration 검증 (null 허용, 음수 불가).
     *
     * @param name 파라미터 이름 (오류 메시지용)
     * @param value 검증할 값
     * @throws IllegalArgumentException 음수인 경우
     */
    public static void requireNonNegative(String name, Duration value) {
        if (value != null && value.isNegative()) {
            throw new IllegalArgumentException(name + " cannot be negative (current: " + value + ")");
        }
    }
}
