package com.roomlink.core.util;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Jittered exponential backoff calculator for reconnects.
 * <p>
 * <b>Formula:</b> {@code t = min(max, base * 2^attempt) + uniform(0, jitterMax)}
 * <ul>
 *   <li>{@code base}: delay before the first reconnect</li>
 *   <li>{@code max}: cap for the exponential part</li>
 *   <li>{@code jitterMax}: upper bound of the random component</li>
 * </ul>
 * </p>
 */
public final class JitterBackoff {
    private JitterBackoff() {
    }

    /**
     * Computes the delay before a reconnect attempt.
     *
     * @param attempt   Retry attempt number (0-based)
     * @param base      Base delay
     * @param max       Maximum delay (cap)
     * @param jitterMax Maximum jitter to add, {@link Duration#ZERO} disables jitter
     * @return Computed delay
     */
    public static Duration next(int attempt, Duration base, Duration max, Duration jitterMax) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0, got " + attempt);
        }
        long baseMs = base.toMillis();
        long expMs = baseMs * (1L << Math.min(attempt, 20)); // cap exponent to avoid overflow

        long cappedMs = Math.min(expMs, max.toMillis());

        long jitterMs = jitterMax.isZero() || jitterMax.isNegative()
                ? 0
                : ThreadLocalRandom.current().nextLong(jitterMax.toMillis() + 1);

        return Duration.ofMillis(cappedMs + jitterMs);
    }

    /**
     * Convenience method with default parameters (base=1s, max=30s, jitter=1s).
     *
     * @param attempt Retry attempt number (0-based)
     * @return Computed delay
     */
    public static Duration next(int attempt) {
        return next(
                attempt,
                Duration.ofSeconds(1),
                Duration.ofSeconds(30),
                Duration.ofSeconds(1)
        );
    }
}
