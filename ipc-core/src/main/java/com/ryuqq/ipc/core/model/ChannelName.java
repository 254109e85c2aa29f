package com.ryuqq.ipc.core.model;

import java.util.regex.Pattern;

/**
 * 원격 저장소 위에 놓인 통신 구조(Cache, Queue, Stream)의 이름.
 *
 * <p>ChannelName은 원격 저장소의 키(또는 키 prefix)로 그대로 사용되며,
 * 같은 구조를 공유하는 모든 peer는 동일한 이름을 사용해야 합니다.
 * 이름의 전역 유일성은 시스템이 보장하지 않습니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 콜론(:), 점(.), 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ChannelName {

    static final char KEY_SEPARATOR = '#';

    private static final Pattern ALLOWED = Pattern.compile("^[a-zA-Z0-9:._\\-]+$");

    private final String value;

    private ChannelName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ChannelName cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("ChannelName length cannot exceed 255 characters");
        }
        if (!ALLOWED.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ChannelName contains invalid characters. Only alphanumeric, ':', '.', '-' and '_' are allowed");
        }
        this.value = value;
    }

    /**
     * ChannelName 생성.
     *
     * @param value 이름
     * @return ChannelName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ChannelName of(String value) {
        return new ChannelName(value);
    }

    /**
     * 이 이름 아래의 하위 키 생성 ({@code name#suffix}).
     *
     * <p>구분자 {@code #}은 이름에 쓸 수 없는 문자이므로, 서로 다른 이름의 하위 키는
     * suffix 내용과 관계없이 겹치지 않습니다.</p>
     *
     * @param suffix 하위 키 (null 또는 빈 문자열 불가)
     * @return 원격 저장소 키
     * @throws IllegalArgumentException suffix가 null이거나 빈 문자열인 경우
     */
    public String child(String suffix) {
        if (suffix == null || suffix.isEmpty()) {
            throw new IllegalArgumentException("suffix cannot be null or empty");
        }
        return value + KEY_SEPARATOR + suffix;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ChannelName that = (ChannelName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ChannelName{" + value + '}';
    }
}
