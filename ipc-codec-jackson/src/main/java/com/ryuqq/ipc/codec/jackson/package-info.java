/**
 * Jackson-based {@link com.ryuqq.ipc.core.spi.PayloadCodec} implementation.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.ipc.codec.jackson;
