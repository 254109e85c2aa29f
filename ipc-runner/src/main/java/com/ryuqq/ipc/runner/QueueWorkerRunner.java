package com.ryuqq.ipc.runner;

import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.error.IpcErrorKind;
import com.ryuqq.ipc.core.error.IpcException;
import com.ryuqq.ipc.core.error.IpcTimeoutException;
import com.ryuqq.ipc.core.error.PoolExhaustedException;
import com.ryuqq.ipc.core.error.StoreException;
import com.ryuqq.ipc.core.model.QueueMessage;
import com.ryuqq.ipc.core.poll.Sleeper;
import com.ryuqq.ipc.core.queue.ReadQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Queue Worker Runner 구현체.
 *
 * <p>ReadQueue에서 메시지를 가져와 worker 스레드 pool에서 MessageHandler로 처리합니다.</p>
 *
 * <p><strong>책임:</strong></p>
 * <ul>
 *   <li>pollTimeout 동안 첫 메시지를 기다린 뒤 batchSize까지 non-blocking pop</li>
 *   <li>메시지별로 worker 스레드에 handler 실행 제출</li>
 *   <li>저장소 장애 시 연속 실패 횟수에 따른 backoff</li>
 *   <li>handler 실패와 decode 실패의 로그 및 집계</li>
 * </ul>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * pump() 호출
 *   ↓
 * popMessageBlocking(pollTimeout)
 *   ├─ timeout → 0 반환
 *   ├─ PoolExhausted / StoreException → backoff sleep, 0 반환
 *   └─ 메시지 → popMessage() 반복 (batchSize까지)
 *   ↓
 * For each message: workerExecutor.submit(handler.handle(message))
 * </pre>
 *
 * <p><strong>전달 보장:</strong> pop은 메시지를 제거하므로 at-most-once입니다. handler가 실패하거나
 * payload가 손상된 메시지는 다시 전달되지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * QueueWorkerRunner&lt;String&gt; runner = new QueueWorkerRunner&lt;&gt;(jobs, message -&gt; process(message.content()),
 *     new QueueWorkerConfig().withConcurrency(4));
 * while (running) {
 *     runner.pump();
 * }
 * runner.shutdown();
 * </pre>
 *
 * @param <T> payload 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class QueueWorkerRunner<T> {

    private static final Logger log = LoggerFactory.getLogger(QueueWorkerRunner.class);

    private final ReadQueue<T> queue;
    private final MessageHandler<T> handler;
    private final QueueWorkerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;
    private final ExecutorService workerExecutor;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicLong handledCount = new AtomicLong();
    private final AtomicLong handlerFailureCount = new AtomicLong();
    private final AtomicLong decodeFailureCount = new AtomicLong();

    /**
     * 생성자 (기본 BackoffCalculator 사용).
     *
     * @param queue 메시지를 가져올 queue
     * @param handler 메시지 처리기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(ReadQueue<T> queue, MessageHandler<T> handler, QueueWorkerConfig config) {
        this(queue, handler, config, new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param queue 메시지를 가져올 queue
     * @param handler 메시지 처리기
     * @param config 설정
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public QueueWorkerRunner(ReadQueue<T> queue,
                             MessageHandler<T> handler,
                             QueueWorkerConfig config,
                             BackoffCalculator backoffCalculator) {
        this(queue, handler, config, backoffCalculator, Sleeper.threadSleep());
    }

    QueueWorkerRunner(ReadQueue<T> queue,
                      MessageHandler<T> handler,
                      QueueWorkerConfig config,
                      BackoffCalculator backoffCalculator,
                      Sleeper sleeper) {
        if (queue == null) {
            throw new IllegalArgumentException("queue cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }

        this.queue = queue;
        this.handler = handler;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
        this.workerExecutor = Executors.newFixedThreadPool(config.concurrency());
    }

    /**
     * 메시지 batch 1회 처리.
     *
     * <p>batch 도중 저장소 장애나 decode 실패가 나면 그때까지 pop한 메시지는 그대로 제출합니다.
     * 이미 queue에서 제거된 메시지이기 때문입니다.</p>
     *
     * @return worker에 제출한 메시지 수 (timeout 또는 장애 시 0)
     * @throws IllegalStateException shutdown 이후 호출한 경우
     * @throws IpcException backoff 대기 중 인터럽트된 경우 (kind INTERRUPTED)
     */
    public int pump() {
        if (workerExecutor.isShutdown()) {
            throw new IllegalStateException("Runner is shut down");
        }

        List<QueueMessage<T>> batch = new ArrayList<>(config.batchSize());
        IpcException storeFailure = null;
        try {
            batch.add(queue.popMessageBlocking(config.pollTimeout()));
            fillBatch(batch);
            consecutiveFailures.set(0);
        } catch (IpcTimeoutException e) {
            consecutiveFailures.set(0);
        } catch (DecodeException e) {
            decodeFailureCount.incrementAndGet();
            log.error("Dropped undecodable message from queue {}: {}", queue.name(), e.getMessage());
        } catch (PoolExhaustedException | StoreException e) {
            storeFailure = e;
        }

        for (QueueMessage<T> message : batch) {
            workerExecutor.submit(() -> process(message));
        }

        if (storeFailure != null) {
            backoff(storeFailure);
        }
        return batch.size();
    }

    private void fillBatch(List<QueueMessage<T>> batch) {
        while (batch.size() < config.batchSize()) {
            Optional<QueueMessage<T>> next = queue.popMessage();
            if (next.isEmpty()) {
                return;
            }
            batch.add(next.get());
        }
    }

    private void process(QueueMessage<T> message) {
        try {
            handler.handle(message);
            handledCount.incrementAndGet();
        } catch (Exception e) {
            handlerFailureCount.incrementAndGet();
            log.error("Handler failed for message {} from queue {}", message.id(), queue.name(), e);
        }
    }

    private void backoff(IpcException failure) {
        int failures = consecutiveFailures.incrementAndGet();
        Duration delay = backoffCalculator.calculate(failures);
        log.warn("Queue {} unavailable ({}: {}), backing off {}ms (consecutive failures: {})",
            queue.name(), failure.kind(), failure.getMessage(), delay.toMillis(), failures);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IpcException(IpcErrorKind.INTERRUPTED, "Interrupted during backoff", e);
        }
    }

    /**
     * Runner 종료 (리소스 정리).
     *
     * <p>ExecutorService를 graceful shutdown하여 진행 중인 작업이
     * shutdownGracePeriod 동안 완료되도록 대기하고, 남은 작업은 강제 종료합니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(config.shutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
            List<Runnable> dropped = workerExecutor.shutdownNow();
            log.warn("Queue {} workers did not finish within {}, forced shutdown ({} pending tasks dropped)",
                queue.name(), config.shutdownGracePeriod(), dropped.size());
        }
    }

    public boolean isShutdown() {
        return workerExecutor.isShutdown();
    }

    /**
     * @return handler가 정상 종료한 메시지 수
     */
    public long handledCount() {
        return handledCount.get();
    }

    /**
     * @return handler가 예외를 던진 메시지 수
     */
    public long handlerFailureCount() {
        return handlerFailureCount.get();
    }

    /**
     * @return decode에 실패해 버려진 메시지 수
     */
    public long decodeFailureCount() {
        return decodeFailureCount.get();
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }
}
