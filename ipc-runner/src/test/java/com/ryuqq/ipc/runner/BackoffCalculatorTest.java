package com.ryuqq.ipc.runner;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void calculate_jitter가_없으면_지수적으로_증가() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.1, () -> 0.0);

        assertThat(calculator.calculate(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(calculator.calculate(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(calculator.calculate(3)).isEqualTo(Duration.ofMillis(400));
    }

    @Test
    void calculate_maxDelay를_넘지_않음() {
        BackoffCalculator calculator = new BackoffCalculator(100, 10_000, 0.1, () -> 0.0);

        assertThat(calculator.calculate(8)).isEqualTo(Duration.ofMillis(10_000));
        assertThat(calculator.calculate(Integer.MAX_VALUE)).isEqualTo(Duration.ofMillis(10_000));
    }

    @Test
    void calculate_jitter는_exponential_x_jitterFactor_이내() {
        BackoffCalculator calculator = new BackoffCalculator(1_000, 300_000, 0.1, () -> 0.5);

        assertThat(calculator.calculate(1)).isEqualTo(Duration.ofMillis(1_050));
        assertThat(calculator.calculate(2)).isEqualTo(Duration.ofMillis(2_100));
    }

    @Test
    void calculate_기본_난수로도_범위_안의_값() {
        BackoffCalculator calculator = new BackoffCalculator();

        for (int attempt = 1; attempt <= 20; attempt++) {
            long millis = calculator.calculate(attempt).toMillis();
            long exponential = Math.min(100L << Math.min(attempt - 1, 62), 10_000L);
            assertThat(millis).isBetween(exponential, Math.min((long) (exponential * 1.1), 10_000L));
        }
    }

    @Test
    void 잘못된_파라미터는_예외() {
        assertThatThrownBy(() -> new BackoffCalculator(0, 100, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 50, 0.1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(100, 1_000, 1.5))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator().calculate(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
