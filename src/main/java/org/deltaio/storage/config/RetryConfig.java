package org.deltaio.storage.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy for requests failing with a transient error.
 * <p>
 * A request is retried at most {@code maxRetries} times and never after
 * {@code retryTimeout} has elapsed since the first attempt.
 *
 * @param maxRetries   the maximum number of retries, 0 disables retrying
 * @param retryTimeout the total time budget for retries
 * @param backoff      the delay schedule between attempts
 */
public record RetryConfig(int maxRetries, Duration retryTimeout, BackoffConfig backoff) {

    public static final int DEFAULT_MAX_RETRIES = 10;
    public static final Duration DEFAULT_RETRY_TIMEOUT = Duration.ofMinutes(3);

    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative, got " + maxRetries);
        }
        Objects.requireNonNull(retryTimeout, "retryTimeout cannot be null");
        Objects.requireNonNull(backoff, "backoff cannot be null");
    }

    public static RetryConfig defaults() {
        return new RetryConfig(DEFAULT_MAX_RETRIES, DEFAULT_RETRY_TIMEOUT, BackoffConfig.defaults());
    }

    public RetryConfig withMaxRetries(int value) {
        return new RetryConfig(value, retryTimeout, backoff);
    }

    public RetryConfig withRetryTimeout(Duration value) {
        return new RetryConfig(maxRetries, value, backoff);
    }

    public RetryConfig withBackoff(BackoffConfig value) {
        return new RetryConfig(maxRetries, retryTimeout, value);
    }
}
