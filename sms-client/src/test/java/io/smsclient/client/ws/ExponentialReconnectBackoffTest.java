package io.smsclient.client.ws;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExponentialReconnectBackoffTest {

    private static final Duration BASE = Duration.ofSeconds(5);
    private static final Duration MAX = Duration.ofSeconds(60);

    @Test
    void doublesPerAttemptUpToMax() {
        ExponentialReconnectBackoff backoff = new ExponentialReconnectBackoff(BASE, MAX, () -> 1.0);

        assertThat(backoff.delayFor(1)).isEqualTo(Duration.ofSeconds(5));
        assertThat(backoff.delayFor(2)).isEqualTo(Duration.ofSeconds(10));
        assertThat(backoff.delayFor(3)).isEqualTo(Duration.ofSeconds(20));
        assertThat(backoff.delayFor(4)).isEqualTo(Duration.ofSeconds(40));
        assertThat(backoff.delayFor(5)).isEqualTo(MAX);
        assertThat(backoff.delayFor(40)).isEqualTo(MAX);
        assertThat(backoff.delayFor(Integer.MAX_VALUE)).isEqualTo(MAX);
    }

    @Test
    void jitterNeverExceedsMax() {
        ExponentialReconnectBackoff low = new ExponentialReconnectBackoff(BASE, MAX, () -> 0.5);
        ExponentialReconnectBackoff high = new ExponentialReconnectBackoff(BASE, MAX, () -> 1.25);

        assertThat(low.delayFor(1)).isEqualTo(Duration.ofMillis(2500));
        assertThat(high.delayFor(3)).isEqualTo(Duration.ofMillis(25_000));
        assertThat(high.delayFor(5)).isEqualTo(MAX);
    }

    @Test
    void randomJitterStaysInRange() {
        ExponentialReconnectBackoff backoff = new ExponentialReconnectBackoff(BASE, MAX);

        for (int i = 0; i < 100; i++) {
            assertThat(backoff.delayFor(2)).isBetween(Duration.ofSeconds(5), Duration.ofSeconds(15));
        }
    }

    @Test
    void noDelayBeforeFirstAttempt() {
        assertThat(new ExponentialReconnectBackoff(BASE, MAX).delayFor(0)).isEqualTo(Duration.ZERO);
    }

    @Test
    void rejectsMaxBelowBase() {
        assertThatThrownBy(() -> new ExponentialReconnectBackoff(MAX, BASE))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
