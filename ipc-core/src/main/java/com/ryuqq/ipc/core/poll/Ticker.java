package com.ryuqq.ipc.core.poll;

/**
 * Monotonic time source used to measure elapsed wait time.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Ticker {

    /**
     * @return current value of a monotonic clock in nanoseconds
     */
    long nanoTime();

    static Ticker system() {
        return System::nanoTime;
    }
}
