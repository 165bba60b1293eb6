package org.deltaio.storage.stores;

import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.OptionParseException;
import org.deltaio.storage.api.StorageOptions;
import org.deltaio.storage.junit.extensions.logging.ExpectLog;
import org.deltaio.storage.junit.extensions.logging.LogLevel;
import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.deltaio.storage.stores.wrappers.LimitObjectStore;
import org.deltaio.storage.stores.wrappers.RetryObjectStore;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ObjectStoresTest {

    @Test
    void testUrlPrefixHandler_WrapsNonRootPrefix() {
        ObjectStore store = new InMemoryObjectStore();
        ObjectStore prefixed = ObjectStores.urlPrefixHandler(store, ObjectPath.parse("/databases/foo/bar"));
        assertEquals("PrefixObjectStore(databases/foo/bar)", prefixed.toString());
    }

    @Test
    void testUrlPrefixHandler_RootIsIdentity() {
        ObjectStore store = new InMemoryObjectStore();
        assertSame(store, ObjectStores.urlPrefixHandler(store, ObjectPath.parse("/")));
        assertEquals("InMemory", ObjectStores.urlPrefixHandler(store, ObjectPath.root()).toString());
    }

    @Test
    void testLimitStoreHandler_WrapsWithConfiguredLimit() {
        ObjectStore store = new InMemoryObjectStore();
        ObjectStore limited = ObjectStores.limitStoreHandler(store,
                StorageOptions.of(Map.of("OBJECT_STORE_CONCURRENCY_LIMIT", "500")));

        assertEquals("LimitStore(500, InMemory)", limited.toString());
        assertEquals(500, ((LimitObjectStore) limited).getMaxRequests());
    }

    @Test
    void testLimitStoreHandler_AbsentIsIdentity() {
        ObjectStore store = new InMemoryObjectStore();
        assertSame(store, ObjectStores.limitStoreHandler(store, StorageOptions.empty()));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring OBJECT_STORE_CONCURRENCY_LIMIT='abc'.*")
    void testLimitStoreHandler_UnparsableIsIdentity() {
        ObjectStore store = new InMemoryObjectStore();
        assertSame(store, ObjectStores.limitStoreHandler(store,
                StorageOptions.of(Map.of("OBJECT_STORE_CONCURRENCY_LIMIT", "abc"))));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Ignoring OBJECT_STORE_CONCURRENCY_LIMIT='0'.*")
    void testLimitStoreHandler_ZeroIsIdentity() {
        ObjectStore store = new InMemoryObjectStore();
        assertSame(store, ObjectStores.limitStoreHandler(store,
                StorageOptions.of(Map.of("OBJECT_STORE_CONCURRENCY_LIMIT", "0"))));
    }

    @Test
    void testRetryStoreHandler_WithoutRetryKeysIsIdentity() throws OptionParseException {
        ObjectStore store = new InMemoryObjectStore();
        assertSame(store, ObjectStores.retryStoreHandler(store, StorageOptions.of(Map.of("other", "x"))));
    }

    @Test
    void testRetryStoreHandler_ParsesRetryKeys() throws OptionParseException {
        ObjectStore store = new InMemoryObjectStore();
        ObjectStore retrying = ObjectStores.retryStoreHandler(store,
                StorageOptions.of(Map.of("max_retries", "3", "retry_timeout", "5s")));

        assertThat(retrying).isInstanceOf(RetryObjectStore.class);
        assertEquals("RetryStore(InMemory)", retrying.toString());
        assertEquals(3, ((RetryObjectStore) retrying).getConfig().maxRetries());
        assertEquals(Duration.ofSeconds(5), ((RetryObjectStore) retrying).getConfig().retryTimeout());
    }

    @Test
    void testRetryStoreHandler_InvalidValueFails() {
        OptionParseException e = assertThrows(OptionParseException.class, () -> ObjectStores.retryStoreHandler(
                new InMemoryObjectStore(), StorageOptions.of(Map.of("max_retries", "many"))));
        assertEquals("max_retries", e.getKey());
    }
}
