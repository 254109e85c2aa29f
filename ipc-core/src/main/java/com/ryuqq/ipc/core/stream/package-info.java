/**
 * Bounded event stream with cursor-based reads.
 *
 * <p>{@link com.ryuqq.ipc.core.stream.EventStream} is the stateless facade;
 * {@link com.ryuqq.ipc.core.stream.StreamReader} keeps a cursor for one consumer.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.core.stream;
