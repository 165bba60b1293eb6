package org.deltaio.storage.registry;

import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.StoreNotRegisteredException;
import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.deltaio.storage.stores.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DefaultObjectStoreRegistryTest {

    private DefaultObjectStoreRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new DefaultObjectStoreRegistry();
    }

    @Test
    void testRegisterStore_ReturnsPreviousStore() throws StoreNotRegisteredException {
        URI url = URI.create("s3://bucket/table");
        ObjectStore a = new InMemoryObjectStore();
        ObjectStore b = new InMemoryObjectStore();

        assertEquals(Optional.empty(), registry.registerStore(url, a));
        assertSame(a, registry.registerStore(url, b).orElseThrow());
        assertSame(b, registry.getStore(url));
    }

    @Test
    void testGetStore_MissingFailsWithHint() {
        URI url = URI.create("memory:///never-registered");
        StoreNotRegisteredException e = assertThrows(StoreNotRegisteredException.class, () -> registry.getStore(url));
        assertThat(e.getMessage()).contains("memory:///never-registered").contains("forget to register");
    }

    @Test
    void testKeysAreFullUrls() throws StoreNotRegisteredException {
        ObjectStore a = new InMemoryObjectStore();
        ObjectStore b = new InMemoryObjectStore();
        registry.registerStore(URI.create("s3://bucket/t1"), a);
        registry.registerStore(URI.create("s3://bucket/t2"), b);

        assertSame(a, registry.getStore(URI.create("s3://bucket/t1")));
        assertSame(b, registry.getStore(URI.create("s3://bucket/t2")));
        assertThrows(StoreNotRegisteredException.class, () -> registry.getStore(URI.create("s3://bucket")));
        assertThat(registry.allStores()).containsOnlyKeys("s3://bucket/t1", "s3://bucket/t2");
        assertEquals("DefaultObjectStoreRegistry[s3://bucket/t1, s3://bucket/t2]", registry.toString());
    }

    @Test
    void testConcurrentRegisterAndGet() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int id = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        URI url = URI.create("memory:///t" + (i % 10));
                        ObjectStore store = new InMemoryObjectStore();
                        registry.registerStore(url, store);
                        assertNotNull(registry.getStore(url));
                        registry.registerStore(URI.create("memory:///own-" + id), store);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(10 + threads, registry.allStores().size());
    }
}
