/**
 * At-most-once work queue: {@link com.ryuqq.ipc.core.queue.WriteQueue} pushes to the tail,
 * {@link com.ryuqq.ipc.core.queue.ReadQueue} pops from the head.
 *
 * <h2>Delivery</h2>
 * <ul>
 *   <li>Each item is handed to exactly one consumer (atomic pop on the store)</li>
 *   <li>No acknowledgement and no redelivery: an item popped by a crashing consumer is lost</li>
 *   <li>Consumers may skip their own items; skipped items stay for other consumers</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.core.queue;
