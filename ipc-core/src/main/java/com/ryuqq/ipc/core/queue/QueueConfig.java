package com.ryuqq.ipc.core.queue;

import com.ryuqq.ipc.core.model.ChannelName;
import com.ryuqq.ipc.core.model.ClientId;
import com.ryuqq.ipc.core.poll.Timeouts;

import java.time.Duration;

/**
 * Work queue 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>name: queue 이름 (원격 list 키)</li>
 *   <li>clientId: 이 참여자의 identity, push한 item에 producer로 기록됨 (선택)</li>
 *   <li>excludeOwnMessages: true이면 ReadQueue가 자신이 push한 item을 건너뜀 (clientId 필수)</li>
 *   <li>readTimeout: {@link ReadQueue#popBlocking()}의 기본 대기 시간 (null 또는 0이면 1회 pop)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 * @param name queue 이름 (필수)
 * @param clientId 참여자 identity (선택)
 * @param excludeOwnMessages 자기 item 제외 여부
 * @param readTimeout 기본 blocking pop timeout (선택)
 */
public record QueueConfig(ChannelName name, ClientId clientId, boolean excludeOwnMessages, Duration readTimeout) {

    /**
     * 익명 참여자, 제외 없음, timeout 없음으로 생성.
     *
     * @param name queue 이름
     */
    public QueueConfig(ChannelName name) {
        this(name, null, false, null);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public QueueConfig {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (excludeOwnMessages && clientId == null) {
            throw new IllegalArgumentException("excludeOwnMessages requires a clientId");
        }
        Timeouts.requireNonNegative("readTimeout", readTimeout);
    }

    public static QueueConfig of(String name) {
        return new QueueConfig(ChannelName.of(name));
    }

    public QueueConfig withClientId(ClientId clientId) {
        return new QueueConfig(name, clientId, excludeOwnMessages, readTimeout);
    }

    /**
     * 자기 item 제외 설정. clientId가 먼저 지정되어 있어야 합니다.
     *
     * @param excludeOwnMessages 제외 여부
     * @return 새 설정
     */
    public QueueConfig withExcludeOwnMessages(boolean excludeOwnMessages) {
        return new QueueConfig(name, clientId, excludeOwnMessages, readTimeout);
    }

    public QueueConfig withReadTimeout(Duration readTimeout) {
        return new QueueConfig(name, clientId, excludeOwnMessages, readTimeout);
    }
}
