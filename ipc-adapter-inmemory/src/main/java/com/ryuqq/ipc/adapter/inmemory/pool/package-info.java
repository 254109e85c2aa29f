/**
 * Bounded, health-checked connection pool over the in-memory store.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.adapter.inmemory.pool;
