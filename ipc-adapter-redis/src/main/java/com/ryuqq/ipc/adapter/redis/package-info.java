/**
 * Redis adapter: Lettuce client connections pooled with commons-pool2.
 *
 * <p>Lists back queues, plain string keys with PX expiry back caches, and Redis streams
 * (XADD MAXLEN, XRANGE, XREAD BLOCK) back event streams.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.ipc.adapter.redis;
