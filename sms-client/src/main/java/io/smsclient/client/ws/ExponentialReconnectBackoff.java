package io.smsclient.client.ws;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * <p>Delay formula: {@code base * 2^(attempt-1)}, capped at {@code max},
 * with random jitter in the range [0.5, 1.5), capped at {@code max} again.
 */
public final class ExponentialReconnectBackoff implements ReconnectBackoff {
    private final long baseMs;
    private final long maxMs;
    private final DoubleSupplier jitter;

    public ExponentialReconnectBackoff(Duration base, Duration max) {
        this(base, max, () -> ThreadLocalRandom.current().nextDouble(0.5, 1.5));
    }

    ExponentialReconnectBackoff(Duration base, Duration max, DoubleSupplier jitter) {
        this.baseMs = base.toMillis();
        this.maxMs = max.toMillis();
        if (baseMs <= 0) {
            throw new IllegalArgumentException("base must be > 0, got: " + base);
        }
        if (maxMs < baseMs) {
            throw new IllegalArgumentException("max must be >= base, got: " + max);
        }
        this.jitter = jitter;
    }

    @Override
    public Duration delayFor(int attempt) {
        if (attempt <= 0) {
            return Duration.ZERO;
        }
        long expDelay;
        if (attempt >= 31) {
            expDelay = Long.MAX_VALUE;
        } else {
            long shift = 1L << (attempt - 1);
            expDelay = shift > maxMs / baseMs ? Long.MAX_VALUE : baseMs * shift;
        }
        long capped = Math.min(maxMs, expDelay);
        long withJitter = (long) (capped * jitter.getAsDouble());
        return Duration.ofMillis(Math.min(maxMs, Math.max(0L, withJitter)));
    }
}
