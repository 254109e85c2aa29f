/**
 * Blocking read protocol shared by every primitive.
 *
 * <p>{@link com.ryuqq.ipc.core.poll.BlockingPoller} turns a single-attempt accessor into a
 * timeout-bounded one. Two strategies are offered:</p>
 * <ul>
 *   <li><strong>pollUntil:</strong> retry a non-blocking accessor, sleeping between attempts</li>
 *   <li><strong>blockUntil:</strong> call the store's native blocking command in bounded slices</li>
 * </ul>
 *
 * <h2>Timeout Rules</h2>
 * <ul>
 *   <li>null or zero: exactly one non-blocking attempt</li>
 *   <li>negative: rejected with {@link java.lang.IllegalArgumentException}</li>
 *   <li>deadline passed: {@link com.ryuqq.ipc.core.error.IpcTimeoutException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.core.poll;
