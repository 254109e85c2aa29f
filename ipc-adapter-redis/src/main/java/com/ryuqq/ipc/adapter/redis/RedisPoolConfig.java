package com.ryuqq.ipc.adapter.redis;

import java.time.Duration;

/**
 * Redis 커넥션 pool 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxTotal: 동시에 빌려줄 수 있는 최대 커넥션 수 (기본 8)</li>
 *   <li>minIdle: 유지할 최소 idle 커넥션 수 (기본 0)</li>
 *   <li>maxWait: 빈 커넥션을 기다리는 최대 시간, 초과 시 PoolExhaustedException (기본 1초)</li>
 *   <li>commandTimeout: Redis 명령 1회 응답 대기 한도 (기본 10초)</li>
 *   <li>testOnBorrow: 빌려줄 때 커넥션 상태 확인 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>주의:</strong> commandTimeout은 blocking 명령(BLPOP, XREAD BLOCK) 한 slice보다
 * 길어야 합니다. 그렇지 않으면 정상적인 대기가 명령 timeout으로 끊깁니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param maxTotal 최대 커넥션 수 (1 이상)
 * @param minIdle 최소 idle 커넥션 수 (0 이상, maxTotal 이하)
 * @param maxWait 커넥션 대기 한도 (0 이상)
 * @param commandTimeout 명령 응답 대기 한도 (양수)
 * @param testOnBorrow borrow 시 health check 여부
 */
public record RedisPoolConfig(
    int maxTotal,
    int minIdle,
    Duration maxWait,
    Duration commandTimeout,
    boolean testOnBorrow
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxTotal=8, minIdle=0, maxWait=1s, commandTimeout=10s, testOnBorrow=true</p>
     */
    public RedisPoolConfig() {
        this(8, 0, Duration.ofSeconds(1), Duration.ofSeconds(10), true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RedisPoolConfig {
        if (maxTotal < 1) {
            throw new IllegalArgumentException("maxTotal must be at least 1 (current: " + maxTotal + ")");
        }
        if (minIdle < 0 || minIdle > maxTotal) {
            throw new IllegalArgumentException(
                "minIdle must be between 0 and maxTotal (current: " + minIdle + ", maxTotal: " + maxTotal + ")");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait cannot be null or negative (current: " + maxWait + ")");
        }
        if (commandTimeout == null || commandTimeout.isZero() || commandTimeout.isNegative()) {
            throw new IllegalArgumentException("commandTimeout must be positive (current: " + commandTimeout + ")");
        }
    }

    public RedisPoolConfig withMaxTotal(int maxTotal) {
        return new RedisPoolConfig(maxTotal, minIdle, maxWait, commandTimeout, testOnBorrow);
    }

    public RedisPoolConfig withMinIdle(int minIdle) {
        return new RedisPoolConfig(maxTotal, minIdle, maxWait, commandTimeout, testOnBorrow);
    }

    public RedisPoolConfig withMaxWait(Duration maxWait) {
        return new RedisPoolConfig(maxTotal, minIdle, maxWait, commandTimeout, testOnBorrow);
    }

    public RedisPoolConfig withCommandTimeout(Duration commandTimeout) {
        return new RedisPoolConfig(maxTotal, minIdle, maxWait, commandTimeout, testOnBorrow);
    }

    public RedisPoolConfig withTestOnBorrow(boolean testOnBorrow) {
        return new RedisPoolConfig(maxTotal, minIdle, maxWait, commandTimeout, testOnBorrow);
    }
}
