package org.deltaio.storage.api;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Immutable string-keyed configuration bag handed to every {@link ObjectStoreFactory}.
 * <p>
 * Keys are case-sensitive. The bag carries no behaviour; each factory or decorator reads
 * the keys it understands and ignores the rest, so provider-specific options pass through
 * untouched.
 * <p>
 * <strong>Thread Safety:</strong> This class is immutable and thread-safe.
 */
public final class StorageOptions {

    private static final StorageOptions EMPTY = new StorageOptions(Map.of());

    private final Map<String, String> options;

    private StorageOptions(Map<String, String> options) {
        this.options = options;
    }

    public static StorageOptions empty() {
        return EMPTY;
    }

    /**
     * Creates options from a map. The map is copied.
     *
     * @param options option name to value
     * @return the options
     */
    public static StorageOptions of(Map<String, String> options) {
        return new StorageOptions(Collections.unmodifiableMap(new LinkedHashMap<>(options)));
    }

    /**
     * Flattens a HOCON section into options.
     * <p>
     * Nested objects become dotted keys, so
     * <pre>
     * backoff_config { init_backoff = 20s }
     * max_retries = 100
     * </pre>
     * yields {@code backoff_config.init_backoff -> "20s"} and {@code max_retries -> "100"}.
     *
     * @param config the section to flatten
     * @return the options
     */
    public static StorageOptions fromConfig(Config config) {
        Map<String, String> flattened = new LinkedHashMap<>();
        for (Map.Entry<String, ConfigValue> entry : config.entrySet()) {
            flattened.put(entry.getKey(), String.valueOf(entry.getValue().unwrapped()));
        }
        return new StorageOptions(Collections.unmodifiableMap(flattened));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(options.get(key));
    }

    public boolean contains(String key) {
        return options.containsKey(key);
    }

    public boolean isEmpty() {
        return options.isEmpty();
    }

    /**
     * Returns the options as an unmodifiable map.
     *
     * @return option name to value
     */
    public Map<String, String> asMap() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return options.equals(((StorageOptions) o).options);
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    // Values may hold credentials, so only keys are rendered.
    @Override
    public String toString() {
        return "StorageOptions" + new TreeSet<>(options.keySet());
    }
}
