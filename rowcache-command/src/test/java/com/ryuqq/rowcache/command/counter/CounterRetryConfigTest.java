package com.ryuqq.rowcache.command.counter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CounterRetryConfigTest {

    @Test
    void 기본_설정값() {
        CounterRetryConfig config = new CounterRetryConfig();

        assertThat(config.maxAttempts()).isEqualTo(20);
        assertThat(config.minDelayMs()).isEqualTo(1);
        assertThat(config.maxDelayMs()).isEqualTo(100);
    }

    @Test
    void delayMs_상한은_시도횟수에_비례해_늘어나고_maxDelayMs에서_멈춘다() {
        CounterRetryConfig config = new CounterRetryConfig(10, 10, 35);

        assertThat(config.delayMs(1, 0.999)).isEqualTo(10);
        assertThat(config.delayMs(2, 0.999)).isEqualTo(19);
        assertThat(config.delayMs(3, 0.999)).isEqualTo(29);
        assertThat(config.delayMs(4, 0.999)).isEqualTo(34);
        assertThat(config.delayMs(1000, 0.999)).isEqualTo(34);
    }

    @Test
    void delayMs_하한은_항상_minDelayMs다() {
        CounterRetryConfig config = new CounterRetryConfig(10, 10, 35);

        assertThat(config.delayMs(5, 0.0)).isEqualTo(10);
    }

    @Test
    void delayMs_큰_시도번호에서도_overflow_없이_범위안에_있다() {
        CounterRetryConfig config = new CounterRetryConfig(Integer.MAX_VALUE, 1000, Long.MAX_VALUE / 4);

        for (int attempt : new int[] {1, 2, 3, Integer.MAX_VALUE}) {
            assertThat(config.delayMs(attempt))
                .isBetween(config.minDelayMs(), config.maxDelayMs());
        }
    }

    @Test
    void hasAttemptsLeft_maxAttempts에_도달하면_false() {
        CounterRetryConfig config = new CounterRetryConfig().withMaxAttempts(3);

        assertThat(config.hasAttemptsLeft(2)).isTrue();
        assertThat(config.hasAttemptsLeft(3)).isFalse();
        assertThat(CounterRetryConfig.noRetry().hasAttemptsLeft(1)).isFalse();
    }

    @Test
    void delayMs_attempt가_0이면_예외() {
        assertThatThrownBy(() -> new CounterRetryConfig().delayMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt");
    }

    @Test
    void constructor_maxAttempts가_0이면_예외() {
        assertThatThrownBy(() -> new CounterRetryConfig(0, 1, 100))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts");
    }

    @Test
    void withDelayRange_max가_min보다_작으면_예외() {
        assertThatThrownBy(() -> new CounterRetryConfig().withDelayRange(50, 10))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs");
    }
}
