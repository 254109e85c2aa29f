package com.ryuqq.ipc.runner;

import com.ryuqq.ipc.core.model.QueueMessage;

/**
 * Queue 메시지 처리기.
 *
 * <p>QueueWorkerRunner의 worker 스레드에서 호출됩니다. 예외를 던지면 runner가 로그를 남기고
 * 실패 횟수만 기록하며, 메시지는 다시 전달되지 않습니다 (at-most-once).</p>
 *
 * @param <T> payload 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageHandler<T> {

    /**
     * @param message pop된 메시지 (id, producer, content)
     * @throws Exception 처리 실패 시
     */
    void handle(QueueMessage<T> message) throws Exception;
}
