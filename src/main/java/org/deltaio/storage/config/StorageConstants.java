package org.deltaio.storage.config;

/**
 * Option keys understood by the storage layer itself.
 * <p>
 * Keys not listed here are forwarded untouched to the backend factories.
 */
public final class StorageConstants {

    /** Maximum number of concurrently in-flight requests against one store. */
    public static final String OBJECT_STORE_CONCURRENCY_LIMIT = "OBJECT_STORE_CONCURRENCY_LIMIT";

    /** Maximum number of retries of a failed request. */
    public static final String MAX_RETRIES = "max_retries";

    /** Total time budget for retrying one request. */
    public static final String RETRY_TIMEOUT = "retry_timeout";

    public static final String BACKOFF_INIT = "backoff_config.init_backoff";

    public static final String BACKOFF_MAX = "backoff_config.max_backoff";

    public static final String BACKOFF_BASE = "backoff_config.base";

    private StorageConstants() {
    }
}
