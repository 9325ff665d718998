package com.ryuqq.discovery.adapter.runner.guard;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * BackoffCalculator 테스트.
 *
 * @author Discovery Team
 * @since 1.0.0
 */
class BackoffCalculatorTest {

    @Test
    void 기본값은_2초부터_두배씩_증가한다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator();

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(2_000);
        assertThat(calculator.calculate(2)).isEqualTo(4_000);
        assertThat(calculator.calculate(3)).isEqualTo(8_000);
        assertThat(calculator.calculate(5)).isEqualTo(32_000);
    }

    @Test
    void 최대_지연을_넘지_않는다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator();

        // when & then
        assertThat(calculator.calculate(6)).isEqualTo(60_000);
        assertThat(calculator.calculate(1_000)).isEqualTo(60_000);
    }

    @Test
    void 지터는_지수_지연의_비율만큼_더해진다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1_000, 60_000, 0.5, () -> 1.0);

        // when & then
        assertThat(calculator.calculate(1)).isEqualTo(1_500);
        assertThat(calculator.calculate(2)).isEqualTo(3_000);
    }

    @Test
    void 지터를_더해도_최대_지연으로_잘린다() {
        // given
        BackoffCalculator calculator = new BackoffCalculator(1_000, 5_000, 1.0, () -> 1.0);

        // when & then
        assertThat(calculator.calculate(3)).isEqualTo(5_000);
    }

    @Test
    void GuardConfig의_값을_사용한다() {
        // given
        GuardConfig config = new GuardConfig().withBaseBackoffMs(100).withMaxBackoffMs(250);

        // when
        BackoffCalculator calculator = new BackoffCalculator(config);

        // then
        assertThat(calculator.calculate(1)).isEqualTo(100);
        assertThat(calculator.calculate(2)).isEqualTo(200);
        assertThat(calculator.calculate(3)).isEqualTo(250);
    }

    @Test
    void 잘못된_입력은_거부한다() {
        BackoffCalculator calculator = new BackoffCalculator();

        assertThatThrownBy(() -> calculator.calculate(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(0, 1_000, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(2_000, 1_000, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffCalculator(1_000, 2_000, 1.5)).isInstanceOf(IllegalArgumentException.class);
    }
}
