package com.ryuqq.ipc.core.poll;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PollingConfigTest {

    @Test
    void defaultConstructor_UsesDefaults() {
        PollingConfig config = new PollingConfig();

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.nativeBlockSlice()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void withMethods_ReturnModifiedCopy() {
        PollingConfig config = new PollingConfig()
            .withPollInterval(Duration.ofMillis(10))
            .withNativeBlockSlice(Duration.ofMillis(200));

        assertThat(config.pollInterval()).isEqualTo(Duration.ofMillis(10));
        assertThat(config.nativeBlockSlice()).isEqualTo(Duration.ofMillis(200));
    }

    @Test
    void invalidValues_Rejected() {
        assertThatThrownBy(() -> new PollingConfig(Duration.ZERO, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("pollInterval");
        assertThatThrownBy(() -> new PollingConfig(Duration.ofMillis(50), Duration.ofNanos(10)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("nativeBlockSlice");
    }
}
