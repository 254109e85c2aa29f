package com.ryuqq.ipc.core.cache;

import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.poll.Timeouts;

import java.time.Duration;

/**
 * Cache 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: cache 이름, 모든 키의 prefix ({@code name:key})</li>
 *   <li>ttl: {@link Cache#set(String, Object)}의 기본 만료 시간 (null 또는 0이면 만료 없음)</li>
 *   <li>readTimeout: {@link Cache#getBlocking(String)}의 기본 대기 시간 (null 또는 0이면 1회 조회)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name cache 이름 (필수)
 * @param ttl 기본 TTL (선택)
 * @param readTimeout 기본 blocking read timeout (선택)
 */
public record CacheConfig(ChannelName name, Duration ttl, Duration readTimeout) {

    /**
     * 만료 없음, blocking read timeout 없음으로 생성.
     *
     * @param name cache 이름
     */
    public CacheConfig(ChannelName name) {
        this(name, null, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CacheConfig {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        Timeouts.requireNonNegative("ttl", ttl);
        Timeouts.requireNonNegative("readTimeout", readTimeout);
    }

    public static CacheConfig of(String name) {
        return new CacheConfig(ChannelName.of(name));
    }

    public CacheConfig withTtl(Duration ttl) {
        return new CacheConfig(name, ttl, readTimeout);
    }

    public CacheConfig withReadTimeout(Duration readTimeout) {
        return new CacheConfig(name, ttl, readTimeout);
    }
}
