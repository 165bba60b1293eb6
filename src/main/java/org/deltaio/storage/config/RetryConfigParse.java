package org.deltaio.storage.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.deltaio.storage.api.OptionParseException;
import org.deltaio.storage.api.StorageOptions;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Mix-in for factories of stores that support request retries.
 * <p>
 * Recognized options:
 * <ul>
 *   <li>{@code max_retries} - non-negative integer</li>
 *   <li>{@code retry_timeout} - duration such as {@code "300s"} or {@code "1h"}</li>
 *   <li>{@code backoff_config.init_backoff} - duration</li>
 *   <li>{@code backoff_config.max_backoff} - duration</li>
 *   <li>{@code backoff_config.base} - positive floating point multiplier</li>
 * </ul>
 * Durations follow the HOCON duration format (a number followed by a unit such as
 * {@code ms}, {@code s}, {@code m}, {@code h} or {@code d}; the unit is required). Absent options keep the
 * values of {@link RetryConfig#defaults()}.
 */
public interface RetryConfigParse {

    /**
     * Parses the retry policy from {@code options}.
     *
     * @param options the store options
     * @return the parsed policy
     * @throws OptionParseException if a present option cannot be parsed
     */
    default RetryConfig parseRetryConfig(StorageOptions options) throws OptionParseException {
        RetryConfig retry = RetryConfig.defaults();
        BackoffConfig backoff = retry.backoff();

        Optional<String> maxRetries = options.get(StorageConstants.MAX_RETRIES);
        if (maxRetries.isPresent()) {
            retry = retry.withMaxRetries(parseNonNegativeInt(StorageConstants.MAX_RETRIES, maxRetries.get()));
        }
        Optional<String> timeout = options.get(StorageConstants.RETRY_TIMEOUT);
        if (timeout.isPresent()) {
            retry = retry.withRetryTimeout(parseDuration(StorageConstants.RETRY_TIMEOUT, timeout.get()));
        }
        Optional<String> init = options.get(StorageConstants.BACKOFF_INIT);
        if (init.isPresent()) {
            backoff = backoff.withInitBackoff(parseDuration(StorageConstants.BACKOFF_INIT, init.get()));
        }
        Optional<String> max = options.get(StorageConstants.BACKOFF_MAX);
        if (max.isPresent()) {
            backoff = backoff.withMaxBackoff(parseDuration(StorageConstants.BACKOFF_MAX, max.get()));
        }
        Optional<String> base = options.get(StorageConstants.BACKOFF_BASE);
        if (base.isPresent()) {
            backoff = backoff.withBase(parsePositiveDouble(StorageConstants.BACKOFF_BASE, base.get()));
        }
        return retry.withBackoff(backoff);
    }

    private static int parseNonNegativeInt(String key, String raw) throws OptionParseException {
        int value;
        try {
            value = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new OptionParseException(key, raw, "a non-negative integer", e);
        }
        if (value < 0) {
            throw new OptionParseException(key, raw, "a non-negative integer", null);
        }
        return value;
    }

    private static double parsePositiveDouble(String key, String raw) throws OptionParseException {
        double value;
        try {
            value = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new OptionParseException(key, raw, "a floating point number", e);
        }
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new OptionParseException(key, raw, "a positive floating point number", null);
        }
        return value;
    }

    private static Duration parseDuration(String key, String raw) throws OptionParseException {
        String trimmed = raw.trim();
        // Typesafe Config reads a bare number as milliseconds; a unit is required here.
        if (trimmed.isEmpty() || Character.isDigit(trimmed.charAt(trimmed.length() - 1))) {
            throw new OptionParseException(key, raw, "a duration with a unit, such as 30s", null);
        }
        Config single = ConfigFactory.parseMap(Map.of("value", raw));
        try {
            Duration value = single.getDuration("value");
            if (value.isNegative()) {
                throw new OptionParseException(key, raw, "a non-negative duration", null);
            }
            return value;
        } catch (ConfigException e) {
            throw new OptionParseException(key, raw, "a duration", e);
        }
    }
}
