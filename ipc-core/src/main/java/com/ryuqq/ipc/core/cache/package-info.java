/**
 * Shared key/value cache on the remote store.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.core.cache;
