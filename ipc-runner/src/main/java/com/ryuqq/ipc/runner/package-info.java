/**
 * Queue consumer runner.
 *
 * <p>{@link com.ryuqq.ipc.runner.QueueWorkerRunner} drives a {@link com.ryuqq.ipc.core.queue.ReadQueue}
 * with a fixed worker pool, and backs off with {@link com.ryuqq.ipc.runner.BackoffCalculator}
 * while the store is failing. Unlike the primitives in {@code ipc-core}, this module owns threads.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.ipc.runner;
