package com.ryuqq.ipc.core.model;

import java.nio.charset.StandardCharsets;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Queue 참여자(producer/consumer)의 논리적 식별자.
 *
 * <p>WriteQueue는 push하는 모든 항목에 자신의 ClientId를 태깅하고,
 * 같은 ClientId로 구성된 ReadQueue는 자기 자신이 넣은 항목을 받지 않도록
 * 설정할 수 있습니다 (self-produced-item exclusion).</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>UTF-8 기준 255 byte 이하</li>
 *   <li>패턴: 영숫자, 콜론(:), 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ClientId {

    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9:._\\-]+$");

    private final String value;

    private ClientId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ClientId cannot be null or blank");
        }
        if (value.getBytes(StandardCharsets.UTF_8).length > 255) {
            throw new IllegalArgumentException("ClientId length cannot exceed 255 bytes");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ClientId contains invalid characters. Only alphanumeric, ':', '.', '-' and '_' are allowed");
        }
        this.value = value;
    }

    /**
     * ClientId 생성.
     *
     * @param value 식별자 값
     * @return ClientId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ClientId of(String value) {
        return new ClientId(value);
    }

    /**
     * 무작위 UUID 기반 ClientId 생성.
     *
     * @return 새 ClientId
     */
    public static ClientId random() {
        return new ClientId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClientId clientId = (ClientId) o;
        return value.equals(clientId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ClientId{" + value + '}';
    }
}
