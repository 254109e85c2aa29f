/**
 * Value objects shared by the cache, queue and stream primitives.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ipc.core.model.ChannelName} - remote key of a structure</li>
 *   <li>{@link com.ryuqq.ipc.core.model.ClientId} - queue participant identity</li>
 *   <li>{@link com.ryuqq.ipc.core.model.StreamCursor} - read position in an event stream</li>
 *   <li>{@link com.ryuqq.ipc.core.model.StreamEvent}, {@link com.ryuqq.ipc.core.model.QueueMessage},
 *       {@link com.ryuqq.ipc.core.model.CacheEntry} - decoded payloads with their metadata</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.core.model;
