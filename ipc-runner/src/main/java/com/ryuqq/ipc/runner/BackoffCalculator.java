package com.ryuqq.ipc.runner;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>저장소 장애(pool 고갈, 연결 실패)가 연속될 때 pump 간격을 지수적으로 늘리되,
 * Jitter를 추가하여 여러 consumer가 동시에 재접속하는 것을 막습니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(failureCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p><strong>예시 (baseDelay=100ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>failureCount=1: 100ms + jitter(0-10ms)</li>
 *   <li>failureCount=2: 200ms + jitter(0-20ms)</li>
 *   <li>failureCount=8: 12800ms (capped at maxDelay=10000ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;
    private final DoubleSupplier random;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=100ms, maxDelay=10000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(100, 10_000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        this(baseDelayMs, maxDelayMs, jitterFactor, () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * 난수 공급자를 주입하여 생성 (테스트용).
     *
     * @param random [0.0, 1.0) 범위의 값을 돌려주는 공급자
     */
    BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor, DoubleSupplier random) {
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }

        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
        this.random = random;
    }

    /**
     * 대기 시간 계산.
     *
     * @param failureCount 연속 실패 횟수 (1부터 시작)
     * @return 다음 pump 전 대기 시간
     * @throws IllegalArgumentException failureCount가 양수가 아닌 경우
     */
    public Duration calculate(int failureCount) {
        if (failureCount <= 0) {
            throw new IllegalArgumentException(
                "failureCount must be positive (current: " + failureCount + ")"
            );
        }

        // shift가 63 이상이면 overflow
        int shift = Math.min(failureCount - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift)
            ? maxDelayMs
            : Math.min(baseDelayMs << shift, maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * random.getAsDouble());

        return Duration.ofMillis(Math.min(exponential + jitter, maxDelayMs));
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
