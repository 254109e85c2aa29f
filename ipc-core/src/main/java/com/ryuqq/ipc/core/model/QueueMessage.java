package com.ryuqq.ipc.core.model;

import java.util.Optional;

/**
 * ReadQueue가 pop한 메시지.
 *
 * @param id push 시 부여된 메시지 id (UUID)
 * @param producer push한 클라이언트 (익명 producer인 경우 null)
 * @param content 역직렬화된 메시지 내용
 * @param <T> 메시지 타입
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record QueueMessage<T>(String id, ClientId producer, T content) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public QueueMessage {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        // producer는 null 허용 (익명 producer)
    }

    public Optional<ClientId> producerId() {
        return Optional.ofNullable(producer);
    }
}
