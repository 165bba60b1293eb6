package org.deltaio.storage.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff parameters.
 *
 * @param initBackoff the delay before the first retry
 * @param maxBackoff  the upper bound of any single delay
 * @param base        the multiplier applied to the previous delay
 */
public record BackoffConfig(Duration initBackoff, Duration maxBackoff, double base) {

    public static final Duration DEFAULT_INIT_BACKOFF = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(15);
    public static final double DEFAULT_BASE = 2.0;

    public BackoffConfig {
        Objects.requireNonNull(initBackoff, "initBackoff cannot be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff cannot be null");
        if (initBackoff.isNegative() || maxBackoff.isNegative()) {
            throw new IllegalArgumentException("Backoff durations cannot be negative");
        }
        if (!(base > 0) || Double.isInfinite(base)) {
            throw new IllegalArgumentException("Backoff base must be a positive finite number, got " + base);
        }
    }

    public static BackoffConfig defaults() {
        return new BackoffConfig(DEFAULT_INIT_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_BASE);
    }

    public BackoffConfig withInitBackoff(Duration value) {
        return new BackoffConfig(value, maxBackoff, base);
    }

    public BackoffConfig withMaxBackoff(Duration value) {
        return new BackoffConfig(initBackoff, value, base);
    }

    public BackoffConfig withBase(double value) {
        return new BackoffConfig(initBackoff, maxBackoff, value);
    }
}
