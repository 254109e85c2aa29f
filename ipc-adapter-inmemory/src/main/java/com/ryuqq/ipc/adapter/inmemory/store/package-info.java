/**
 * In-memory remote store.
 *
 * <p>{@link com.ryuqq.ipc.adapter.inmemory.store.InMemoryRemoteStore} reproduces the subset of
 * Redis key/value, list and stream semantics the IPC primitives rely on, so the whole stack can
 * be exercised without a server.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.adapter.inmemory.store;
