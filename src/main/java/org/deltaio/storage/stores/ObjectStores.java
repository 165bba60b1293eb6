package org.deltaio.storage.stores;

import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.OptionParseException;
import org.deltaio.storage.api.StorageOptions;
import org.deltaio.storage.config.RetryConfigParse;
import org.deltaio.storage.config.StorageConstants;
import org.deltaio.storage.stores.wrappers.LimitObjectStore;
import org.deltaio.storage.stores.wrappers.PrefixObjectStore;
import org.deltaio.storage.stores.wrappers.RetryObjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Conditional decoration of stores built by factories.
 * <p>
 * Each handler returns its input unchanged when the decoration would be a no-op, so a
 * factory can apply all of them unconditionally without stacking empty layers.
 */
public final class ObjectStores {

    private static final Logger log = LoggerFactory.getLogger(ObjectStores.class);

    private static final List<String> RETRY_KEYS = List.of(
            StorageConstants.MAX_RETRIES,
            StorageConstants.RETRY_TIMEOUT,
            StorageConstants.BACKOFF_INIT,
            StorageConstants.BACKOFF_MAX,
            StorageConstants.BACKOFF_BASE);

    private static final RetryConfigParse RETRY_PARSER = new RetryConfigParse() { };

    private ObjectStores() {
    }

    /**
     * Rebases {@code store} under {@code prefix}.
     *
     * @return {@code store} itself when {@code prefix} is the root, a {@link PrefixObjectStore} otherwise
     */
    public static ObjectStore urlPrefixHandler(ObjectStore store, ObjectPath prefix) {
        if (prefix.isRoot()) {
            return store;
        }
        return new PrefixObjectStore(store, prefix);
    }

    /**
     * Limits concurrent requests on {@code store} to the value of
     * {@link StorageConstants#OBJECT_STORE_CONCURRENCY_LIMIT}.
     *
     * @return {@code store} itself when the option is absent or not a positive integer
     */
    public static ObjectStore limitStoreHandler(ObjectStore store, StorageOptions options) {
        Optional<Integer> limit = concurrencyLimit(options);
        if (limit.isEmpty()) {
            return store;
        }
        return new LimitObjectStore(store, limit.get());
    }

    /**
     * Wraps {@code store} in a {@link RetryObjectStore} when any retry option is present.
     *
     * @return {@code store} itself when no retry option is set
     * @throws OptionParseException if a retry option cannot be parsed
     */
    public static ObjectStore retryStoreHandler(ObjectStore store, StorageOptions options) throws OptionParseException {
        if (RETRY_KEYS.stream().noneMatch(options::contains)) {
            return store;
        }
        return new RetryObjectStore(store, RETRY_PARSER.parseRetryConfig(options));
    }

    static Optional<Integer> concurrencyLimit(StorageOptions options) {
        Optional<String> raw = options.get(StorageConstants.OBJECT_STORE_CONCURRENCY_LIMIT);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        int limit;
        try {
            limit = Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            limit = 0;
        }
        if (limit > 0) {
            return Optional.of(limit);
        }
        log.warn("Ignoring {}='{}': expected a positive integer",
                StorageConstants.OBJECT_STORE_CONCURRENCY_LIMIT, raw.get());
        return Optional.empty();
    }
}
