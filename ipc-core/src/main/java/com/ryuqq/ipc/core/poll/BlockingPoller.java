package com.ryuqq.ipc.core.poll;

import com.ryuqq.ipc.core.error.IpcErrorKind;
import com.ryuqq.ipc.core.error.IpcException;
import com.ryuqq.ipc.core.error.IpcTimeoutException;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Timeout 기반 blocking read 루프.
 *
 * <p>한 번만 시도하는 non-blocking 접근자를 timeout으로 제한된 blocking 접근자로 바꿉니다.
 * Cache, Stream, 그리고 self-exclusion이 켜진 ReadQueue가 공통으로 사용합니다.</p>
 *
 * <p><strong>알고리즘 ({@link #pollUntil}):</strong></p>
 * <pre>
 * loop:
 *   value = tryOnce()            → 값이 있으면 즉시 반환
 *   remaining = timeout - elapsed
 *   remaining &lt;= 0              → IpcTimeoutException
 *   sleep(min(pollInterval, remaining))
 * </pre>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>timeout이 0 또는 null이면 정확히 한 번만 시도</li>
 *   <li>값 없음에만 재시도하며, tryOnce가 던진 예외는 그대로 전파 (fail-fast)</li>
 *   <li>커넥션은 tryOnce 내부에서 빌리고 반환하므로 sleep 동안 커넥션을 점유하지 않음</li>
 *   <li>외부 취소 수단 없음: 대기를 끝내는 방법은 timeout 경과뿐이며, sleep 중 인터럽트는
 *       {@link IpcErrorKind#INTERRUPTED} 오류로 보고됨</li>
 * </ul>
 *
 * <p>빈 소스에 대해 timeout 이상, timeout + pollInterval (+ 마지막 tryOnce 소요 시간) 이하의
 * 시간 후에 {@link IpcTimeoutException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class BlockingPoller {

    private final Duration pollInterval;
    private final Ticker ticker;
    private final Sleeper sleeper;

    /**
     * 기본 설정({@link PollingConfig#PollingConfig()})으로 생성.
     */
    public BlockingPoller() {
        this(new PollingConfig());
    }

    public BlockingPoller(PollingConfig config) {
        this(requireConfig(config).pollInterval(), Ticker.system(), Sleeper.threadSleep());
    }

    /**
     * 시계와 sleep 함수를 주입하는 생성자 (결정적 테스트용).
     *
     * @param pollInterval poll 간격 (양수)
     * @param ticker 경과 시간 측정용 시계
     * @param sleeper 대기 함수
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BlockingPoller(Duration pollInterval, Ticker ticker, Sleeper sleeper) {
        if (pollInterval == null || pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive (current: " + pollInterval + ")");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.pollInterval = pollInterval;
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /**
     * 값이 나오거나 timeout이 지날 때까지 tryOnce를 반복 호출.
     *
     * @param timeout 최대 대기 시간 (0 또는 null이면 1회 시도)
     * @param tryOnce non-blocking 접근자 (null 반환 불가)
     * @param <T> 값 타입
     * @return 처음으로 얻은 값
     * @throws IpcTimeoutException timeout 내에 값이 없는 경우
     * @throws IllegalArgumentException timeout이 음수이거나 tryOnce가 null인 경우
     */
    public <T> T pollUntil(Duration timeout, Supplier<Optional<T>> tryOnce) {
        if (tryOnce == null) {
            throw new IllegalArgumentException("tryOnce cannot be null");
        }
        Duration budget = Timeouts.normalize(timeout);
        long budgetNanos = toNanos(budget);
        long start = ticker.nanoTime();
        long intervalNanos = toNanos(pollInterval);

        while (true) {
            Optional<T> value = requireResult(tryOnce.get());
            if (value.isPresent()) {
                return value.get();
            }

            long remaining = budgetNanos - (ticker.nanoTime() - start);
            if (remaining <= 0) {
                throw new IpcTimeoutException("No value within " + budget);
            }
            sleep(Duration.ofNanos(Math.min(intervalNanos, remaining)));
        }
    }

    /**
     * 저장소의 native blocking 명령을 slice 단위로 반복 호출.
     *
     * <p>각 slice는 하나의 round trip이며, 커넥션은 slice마다 새로 빌리고 반환합니다.
     * timeout이 0 또는 null이면 native 명령 대신 nonBlocking을 정확히 한 번 호출합니다.</p>
     *
     * @param timeout 최대 대기 시간 (0 또는 null이면 1회 non-blocking 시도)
     * @param slice native 명령 1회 최대 대기
     * @param blocking 주어진 시간만큼 저장소에서 대기하는 접근자
     * @param nonBlocking 대기 없는 1회 접근자
     * @param <T> 값 타입
     * @return 처음으로 얻은 값
     * @throws IpcTimeoutException timeout 내에 값이 없는 경우
     */
    public <T> T blockUntil(Duration timeout,
                            Duration slice,
                            Function<Duration, Optional<T>> blocking,
                            Supplier<Optional<T>> nonBlocking) {
        if (slice == null || slice.toMillis() <= 0) {
            throw new IllegalArgumentException("slice must be at least 1ms (current: " + slice + ")");
        }
        if (blocking == null || nonBlocking == null) {
            throw new IllegalArgumentException("blocking and nonBlocking accessors cannot be null");
        }
        Duration budget = Timeouts.normalize(timeout);
        if (budget.isZero()) {
            return requireResult(nonBlocking.get())
                .orElseThrow(() -> new IpcTimeoutException("No value available (non-blocking read)"));
        }

        long budgetNanos = toNanos(budget);
        long start = ticker.nanoTime();
        while (true) {
            long remaining = budgetNanos - (ticker.nanoTime() - start);
            if (remaining <= 0) {
                throw new IpcTimeoutException("No value within " + budget);
            }
            // native 명령은 ms 단위: 1ms 미만으로 내려가지 않도록 올림
            long waitMillis = Math.max(1L, (Math.min(toNanos(slice), remaining) + 999_999L) / 1_000_000L);
            Optional<T> value = requireResult(blocking.apply(Duration.ofMillis(waitMillis)));
            if (value.isPresent()) {
                return value.get();
            }
        }
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    private void sleep(Duration duration) {
        try {
            sleeper.sleep(duration);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IpcException(IpcErrorKind.INTERRUPTED, "Interrupted while waiting between polls", e);
        }
    }

    private static <T> Optional<T> requireResult(Optional<T> result) {
        if (result == null) {
            throw new IllegalStateException("accessor returned null instead of Optional.empty()");
        }
        return result;
    }

    private static long toNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private static PollingConfig requireConfig(PollingConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return config;
    }
}
