package com.ryuqq.lifecycle.application.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisplayName("BackoffCalculator 테스트")
class BackoffCalculatorTest {

    @Test
    @DisplayName("jitter 가 없으면 지연 시간은 정확히 두 배씩 늘어난다")
    void exponentialWithoutJitter() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new ConflictRetryConfig(5, 10, 1000, 0.0));

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(10);
        assertThat(calculator.calculate(2)).isEqualTo(20);
        assertThat(calculator.calculate(3)).isEqualTo(40);
    }

    @Test
    @DisplayName("jitter 는 지수 지연값의 jitterFactor 비율 이내다")
    void jitterWithinBounds() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new ConflictRetryConfig(5, 100, 10_000, 0.5));

        // when & then
        for (int i = 0; i < 50; i++) {
            assertThat(calculator.calculate(2)).isBetween(200L, 300L);
        }
    }

    @Test
    @DisplayName("지연 시간은 maxDelayMs 를 넘지 않는다")
    void cappedAtMax() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(new ConflictRetryConfig(5, 10, 200, 0.1));

        // when & then
        assertThat(calculator.calculate(10)).isEqualTo(200);
        assertThat(calculator.calculate(100)).isEqualTo(200);
        assertThat(calculator.getBaseDelayMs()).isEqualTo(10);
        assertThat(calculator.getMaxDelayMs()).isEqualTo(200);
    }

    @Test
    @DisplayName("retry 는 1 이상이어야 한다")
    void rejectsNonPositiveRetry() {
        BackoffCalculator calculator = new BackoffCalculator(new ConflictRetryConfig());

        assertThatThrownBy(() -> calculator.calculate(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("config cannot be null");
    }
}
