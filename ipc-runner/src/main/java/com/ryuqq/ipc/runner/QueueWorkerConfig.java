package com.ryuqq.ipc.runner;

import java.time.Duration;

/**
 * QueueWorkerRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollTimeout: pump() 1회에서 첫 메시지를 기다리는 최대 시간 (기본 1초)</li>
 *   <li>batchSize: pump() 1회에 pop할 최대 메시지 수 (기본 10)</li>
 *   <li>concurrency: 동시 처리 스레드 수 (기본 5)</li>
 *   <li>shutdownGracePeriod: shutdown 시 진행 중인 작업을 기다리는 시간 (기본 30초)</li>
 * </ul>
 *
 * <p><strong>성능 튜닝 가이드:</strong></p>
 * <ul>
 *   <li>높은 처리량: batchSize 증가 (10 → 50), concurrency 증가 (5 → 20)</li>
 *   <li>빠른 종료 반응: pollTimeout 감소 (1s → 200ms)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param pollTimeout 첫 메시지 대기 시간 (양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param concurrency 동시 처리 스레드 수 (1 이상이어야 함)
 * @param shutdownGracePeriod graceful shutdown 대기 시간 (0 이상이어야 함)
 */
public record QueueWorkerConfig(
    Duration pollTimeout,
    int batchSize,
    int concurrency,
    Duration shutdownGracePeriod
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollTimeout=1s, batchSize=10, concurrency=5, shutdownGracePeriod=30s</p>
     */
    public QueueWorkerConfig() {
        this(Duration.ofSeconds(1), 10, 5, Duration.ofSeconds(30));
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueWorkerConfig {
        if (pollTimeout == null || pollTimeout.isZero() || pollTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "pollTimeout must be positive (current: " + pollTimeout + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (shutdownGracePeriod == null || shutdownGracePeriod.isNegative()) {
            throw new IllegalArgumentException(
                "shutdownGracePeriod cannot be null or negative (current: " + shutdownGracePeriod + ")"
            );
        }
    }

    /**
     * pollTimeout만 변경한 새 인스턴스 생성.
     */
    public QueueWorkerConfig withPollTimeout(Duration pollTimeout) {
        return new QueueWorkerConfig(pollTimeout, batchSize, concurrency, shutdownGracePeriod);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public QueueWorkerConfig withBatchSize(int batchSize) {
        return new QueueWorkerConfig(pollTimeout, batchSize, concurrency, shutdownGracePeriod);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public QueueWorkerConfig withConcurrency(int concurrency) {
        return new QueueWorkerConfig(pollTimeout, batchSize, concurrency, shutdownGracePeriod);
    }

    public QueueWorkerConfig withShutdownGracePeriod(Duration shutdownGracePeriod) {
        return new QueueWorkerConfig(pollTimeout, batchSize, concurrency, shutdownGracePeriod);
    }
}
