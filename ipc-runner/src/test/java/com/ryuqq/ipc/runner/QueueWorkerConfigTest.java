package com.ryuqq.ipc.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * QueueWorkerConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class QueueWorkerConfigTest {

    @Test
    void defaultConstructor() {
        QueueWorkerConfig config = new QueueWorkerConfig();

        assertEquals(Duration.ofSeconds(1), config.pollTimeout());
        assertEquals(10, config.batchSize());
        assertEquals(5, config.concurrency());
        assertEquals(Duration.ofSeconds(30), config.shutdownGracePeriod());
    }

    @Test
    void withMethodsKeepOtherValues() {
        QueueWorkerConfig config = new QueueWorkerConfig().withBatchSize(50).withConcurrency(20);

        assertEquals(50, config.batchSize());
        assertEquals(20, config.concurrency());
        assertEquals(Duration.ofSeconds(1), config.pollTimeout());
    }

    @Test
    void invalidValues() {
        QueueWorkerConfig config = new QueueWorkerConfig();

        assertThrows(IllegalArgumentException.class, () -> config.withPollTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.withBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> config.withConcurrency(0));
        assertThrows(IllegalArgumentException.class, () -> config.withShutdownGracePeriod(Duration.ofMillis(-1)));
    }
}
