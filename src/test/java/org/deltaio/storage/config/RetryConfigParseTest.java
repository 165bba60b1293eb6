package org.deltaio.storage.config;

import org.deltaio.storage.api.OptionParseException;
import org.deltaio.storage.api.StorageOptions;
import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RetryConfigParseTest {

    private static class TestFactory implements RetryConfigParse {
    }

    private final TestFactory factory = new TestFactory();

    @Test
    void testParsesAllKeys() throws OptionParseException {
        StorageOptions options = StorageOptions.of(Map.of(
                "max_retries", "100",
                "retry_timeout", "300s",
                "backoff_config.init_backoff", "20s",
                "backoff_config.max_backoff", "1h",
                "backoff_config.base", "50.0"));

        RetryConfig config = factory.parseRetryConfig(options);

        assertEquals(100, config.maxRetries());
        assertEquals(Duration.ofSeconds(300), config.retryTimeout());
        assertEquals(Duration.ofSeconds(20), config.backoff().initBackoff());
        assertEquals(Duration.ofSeconds(3600), config.backoff().maxBackoff());
        assertEquals(50.0, config.backoff().base());
    }

    @Test
    void testAbsentKeysKeepDefaults() throws OptionParseException {
        RetryConfig config = factory.parseRetryConfig(StorageOptions.of(Map.of("max_retries", "2")));

        assertEquals(2, config.maxRetries());
        assertEquals(RetryConfig.DEFAULT_RETRY_TIMEOUT, config.retryTimeout());
        assertEquals(BackoffConfig.defaults(), config.backoff());
        assertEquals(RetryConfig.defaults(), factory.parseRetryConfig(StorageOptions.empty()));
    }

    @ParameterizedTest
    @CsvSource({
            "500ms, 500",
            "2m, 120000",
            "1d, 86400000",
            "20 seconds, 20000"
    })
    void testDurationUnits(String raw, long expectedMillis) throws OptionParseException {
        RetryConfig config = factory.parseRetryConfig(StorageOptions.of(Map.of("retry_timeout", raw)));
        assertEquals(Duration.ofMillis(expectedMillis), config.retryTimeout());
    }

    @Test
    void testMalformedIntegerNamesKey() {
        OptionParseException e = assertThrows(OptionParseException.class,
                () -> factory.parseRetryConfig(StorageOptions.of(Map.of("max_retries", "abc"))));

        assertEquals("max_retries", e.getKey());
        assertEquals("abc", e.getRawValue());
        assertThat(e.getMessage()).contains("max_retries").contains("\"abc\"");
    }

    @Test
    void testNegativeRetriesRejected() {
        assertThrows(OptionParseException.class,
                () -> factory.parseRetryConfig(StorageOptions.of(Map.of("max_retries", "-1"))));
    }

    @Test
    void testMalformedDurationNamesKey() {
        OptionParseException e = assertThrows(OptionParseException.class,
                () -> factory.parseRetryConfig(StorageOptions.of(Map.of("backoff_config.max_backoff", "soon"))));

        assertEquals("backoff_config.max_backoff", e.getKey());
        assertThat(e.getMessage()).contains("soon");
    }

    @ParameterizedTest
    @ValueSource(strings = {"300", " 42 ", "1.5"})
    void testDurationWithoutUnitRejected(String raw) {
        OptionParseException e = assertThrows(OptionParseException.class,
                () -> factory.parseRetryConfig(StorageOptions.of(Map.of("retry_timeout", raw))));

        assertEquals("retry_timeout", e.getKey());
        assertEquals(raw, e.getRawValue());
    }

    @Test
    void testMalformedBaseNamesKey() {
        OptionParseException e = assertThrows(OptionParseException.class,
                () -> factory.parseRetryConfig(StorageOptions.of(Map.of("backoff_config.base", "fast"))));
        assertEquals("backoff_config.base", e.getKey());
    }
}
