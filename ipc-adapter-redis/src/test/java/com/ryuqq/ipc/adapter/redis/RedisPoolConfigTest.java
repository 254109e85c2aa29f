package com.ryuqq.ipc.adapter.redis;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RedisPoolConfig 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RedisPoolConfigTest {

    @Test
    void defaultConstructor() {
        RedisPoolConfig config = new RedisPoolConfig();

        assertEquals(8, config.maxTotal());
        assertEquals(0, config.minIdle());
        assertEquals(Duration.ofSeconds(1), config.maxWait());
        assertEquals(Duration.ofSeconds(10), config.commandTimeout());
        assertTrue(config.testOnBorrow());
    }

    @Test
    void withMethods() {
        RedisPoolConfig config = new RedisPoolConfig()
            .withMaxTotal(16)
            .withMinIdle(2)
            .withMaxWait(Duration.ZERO)
            .withTestOnBorrow(false);

        assertEquals(16, config.maxTotal());
        assertEquals(2, config.minIdle());
        assertEquals(Duration.ZERO, config.maxWait());
        assertFalse(config.testOnBorrow());
    }

    @Test
    void invalidValues() {
        RedisPoolConfig config = new RedisPoolConfig();

        assertThrows(IllegalArgumentException.class, () -> config.withMaxTotal(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMinIdle(9));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxWait(Duration.ofMillis(-1)));
        assertThrows(IllegalArgumentException.class, () -> config.withCommandTimeout(Duration.ZERO));
    }
}
