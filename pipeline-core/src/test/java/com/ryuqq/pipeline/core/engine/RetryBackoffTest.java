package com.ryuqq.pipeline.core.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryBackoff 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class RetryBackoffTest {

    @Test
    void fixed_AlwaysReturnsBaseDelay() {
        // given
        RetryBackoff backoff = new RetryBackoff(BackoffStrategy.FIXED, 250, 5000, 0.5, () -> 0.9);

        // when & then
        assertThat(backoff.delayMs(1)).isEqualTo(250);
        assertThat(backoff.delayMs(5)).isEqualTo(250);
    }

    @Test
    void exponential_DoublesPerAttemptWithoutJitter() {
        // given
        RetryBackoff backoff = new RetryBackoff(BackoffStrategy.EXPONENTIAL, 100, 10_000, 0.0, () -> 0.5);

        // when & then
        assertThat(backoff.delayMs(1)).isEqualTo(100);
        assertThat(backoff.delayMs(2)).isEqualTo(200);
        assertThat(backoff.delayMs(3)).isEqualTo(400);
    }

    @Test
    void exponential_AddsJitterWithinFactor() {
        // given
        RetryBackoff backoff = new RetryBackoff(BackoffStrategy.EXPONENTIAL, 1000, 300_000, 0.1, () -> 0.5);

        // when
        long delay = backoff.delayMs(2);

        // then
        assertThat(delay).isEqualTo(2000 + 100);
    }

    @Test
    void exponential_CappedAtMaxDelay() {
        // given
        RetryBackoff backoff = new RetryBackoff(BackoffStrategy.EXPONENTIAL, 1000, 5000, 0.1, () -> 0.99);

        // when & then
        assertThat(backoff.delayMs(10)).isEqualTo(5000);
        assertThat(backoff.delayMs(64)).isEqualTo(5000);
    }

    @Test
    void zeroBaseDelay_NeverWaits() {
        // given
        RetryBackoff backoff = new RetryBackoff(EngineConfig.noDelay());

        // when & then
        assertThat(backoff.delayMs(1)).isZero();
        assertThat(backoff.delayMs(3)).isZero();
    }

    @Test
    void delayMs_NonPositiveAttempt_ThrowsException() {
        // given
        RetryBackoff backoff = new RetryBackoff(new EngineConfig());

        // when & then
        assertThatThrownBy(() -> backoff.delayMs(0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("attempt must be positive");
    }

    @Test
    void constructor_MaxBelowBase_ThrowsException() {
        assertThatThrownBy(() -> new RetryBackoff(BackoffStrategy.FIXED, 500, 100, 0.1, Math::random))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxDelayMs must be >= baseDelayMs");
    }
}
