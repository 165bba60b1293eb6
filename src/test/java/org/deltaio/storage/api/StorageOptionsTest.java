package org.deltaio.storage.api;

import com.typesafe.config.ConfigFactory;
import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StorageOptionsTest {

    @Test
    void testOf_CopiesInput() {
        Map<String, String> source = new HashMap<>();
        source.put("max_retries", "3");
        StorageOptions options = StorageOptions.of(source);
        source.put("max_retries", "5");

        assertThat(options.get("max_retries")).contains("3");
        assertThrows(UnsupportedOperationException.class, () -> options.asMap().put("x", "y"));
    }

    @Test
    void testKeysAreCaseSensitive() {
        StorageOptions options = StorageOptions.of(Map.of("OBJECT_STORE_CONCURRENCY_LIMIT", "10"));
        assertTrue(options.contains("OBJECT_STORE_CONCURRENCY_LIMIT"));
        assertFalse(options.contains("object_store_concurrency_limit"));
    }

    @Test
    void testFromConfig_FlattensNestedKeys() {
        StorageOptions options = StorageOptions.fromConfig(ConfigFactory.parseString(
                "max_retries = 4\n"
                        + "backoff_config { init_backoff = 20s, base = 1.5 }"));

        assertThat(options.get("max_retries")).contains("4");
        assertThat(options.get("backoff_config.init_backoff")).contains("20s");
        assertThat(options.get("backoff_config.base")).contains("1.5");
    }

    @Test
    void testToString_HidesValues() {
        StorageOptions options = StorageOptions.of(Map.of("aws_secret_access_key", "s3cr3t"));
        assertThat(options.toString()).contains("aws_secret_access_key").doesNotContain("s3cr3t");
    }

    @Test
    void testEmpty() {
        assertTrue(StorageOptions.empty().isEmpty());
        assertEquals(StorageOptions.empty(), StorageOptions.of(Map.of()));
    }
}
