package org.deltaio.storage.registry;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.deltaio.storage.api.DeltaStorageException;
import org.deltaio.storage.api.InvalidTableLocationException;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreFactory;
import org.deltaio.storage.api.StorageOptions;
import org.deltaio.storage.api.StoreWithRoot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps URL schemes to the factories that build stores for them.
 * <p>
 * Keys are normalized to {@code "<scheme>://"} in lower case. Resolution is a pure
 * construction path: every call to {@link #resolve} invokes the factory again, nothing is
 * cached. Use an {@link org.deltaio.storage.api.ObjectStoreRegistry} to reuse live stores.
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe. Registration and lookup may
 * run concurrently.
 */
public class FactoryRegistry {

    private static final Logger log = LoggerFactory.getLogger(FactoryRegistry.class);

    private final ConcurrentMap<String, ObjectStoreFactory> factories = new ConcurrentHashMap<>();

    /**
     * Creates a registry with {@code memory://} and {@code file://} registered.
     */
    public static FactoryRegistry withDefaults() {
        FactoryRegistry registry = new FactoryRegistry();
        DefaultObjectStoreFactory defaults = new DefaultObjectStoreFactory();
        registry.register("memory", defaults);
        registry.register("file", defaults);
        return registry;
    }

    /**
     * Normalizes a scheme to its registry key.
     *
     * @param scheme a scheme with or without the {@code "://"} suffix
     * @return the key, e.g. {@code "s3://"}
     */
    public static String schemeKey(String scheme) {
        if (scheme == null || scheme.isBlank()) {
            throw new IllegalArgumentException("scheme cannot be null or blank");
        }
        String bare = scheme.endsWith("://") ? scheme.substring(0, scheme.length() - 3) : scheme;
        return bare.toLowerCase(Locale.ROOT) + "://";
    }

    /**
     * Registers {@code factory} for {@code scheme}.
     *
     * @return the factory previously registered for the scheme, if any
     */
    public Optional<ObjectStoreFactory> register(String scheme, ObjectStoreFactory factory) {
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        String key = schemeKey(scheme);
        ObjectStoreFactory previous = factories.put(key, factory);
        if (previous != null && previous != factory) {
            log.info("Replaced object store factory for {}: {} -> {}", key, previous, factory);
        } else {
            log.debug("Registered object store factory for {}: {}", key, factory);
        }
        return Optional.ofNullable(previous);
    }

    /**
     * Registers the factories named in a configuration section.
     * <p>
     * Each entry maps a scheme to the fully qualified name of an {@link ObjectStoreFactory}
     * with a public no-arg constructor:
     * <pre>
     * factories {
     *   s3 = "com.example.S3ObjectStoreFactory"
     * }
     * </pre>
     *
     * @param factoriesConfig the section with scheme keys
     * @throws IllegalArgumentException if a class cannot be loaded or instantiated
     */
    public void registerFromConfig(Config factoriesConfig) {
        for (Map.Entry<String, ConfigValue> entry : factoriesConfig.root().entrySet()) {
            String scheme = entry.getKey();
            String className = String.valueOf(entry.getValue().unwrapped());
            register(scheme, instantiate(scheme, className));
        }
    }

    private static ObjectStoreFactory instantiate(String scheme, String className) {
        try {
            Constructor<?> constructor = Class.forName(className).getConstructor();
            Object instance = constructor.newInstance();
            if (!(instance instanceof ObjectStoreFactory)) {
                throw new IllegalArgumentException(String.format(
                        "Factory class '%s' for scheme '%s' does not implement ObjectStoreFactory",
                        className, scheme));
            }
            log.debug("Instantiated object store factory '{}' for scheme '{}'", className, scheme);
            return (ObjectStoreFactory) instance;
        } catch (ReflectiveOperationException | LinkageError e) {
            throw new IllegalArgumentException(String.format(
                    "Failed to instantiate factory class '%s' for scheme '%s': %s", className, scheme, e), e);
        }
    }

    /**
     * Returns the factory registered for the scheme of {@code url}.
     */
    public Optional<ObjectStoreFactory> lookup(URI url) {
        if (url.getScheme() == null) {
            return Optional.empty();
        }
        return lookup(url.getScheme());
    }

    /**
     * Returns the factory registered for {@code scheme}.
     */
    public Optional<ObjectStoreFactory> lookup(String scheme) {
        return Optional.ofNullable(factories.get(schemeKey(scheme)));
    }

    /**
     * Builds a store and its root path for {@code url}.
     *
     * @throws InvalidTableLocationException if no factory handles the scheme of {@code url}
     * @throws DeltaStorageException         if the factory fails
     */
    public StoreWithRoot resolve(URI url, StorageOptions options) throws DeltaStorageException {
        Optional<ObjectStoreFactory> factory = lookup(url);
        if (factory.isEmpty()) {
            throw new InvalidTableLocationException(url,
                    "Invalid table location " + url + ": no object store factory registered for scheme '"
                            + url.getScheme() + "'", null);
        }
        return factory.get().parseUrlOpts(url, options);
    }

    /**
     * Builds the store for {@code url}, discarding its root path.
     */
    public ObjectStore storeFor(URI url, StorageOptions options) throws DeltaStorageException {
        return resolve(url, options).store();
    }

    /**
     * Returns the registered factories keyed by {@code "<scheme>://"}.
     */
    public Map<String, ObjectStoreFactory> asMap() {
        return Map.copyOf(factories);
    }

    @Override
    public String toString() {
        return "FactoryRegistry" + new TreeSet<>(factories.keySet());
    }
}
