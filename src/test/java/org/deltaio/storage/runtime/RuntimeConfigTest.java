package org.deltaio.storage.runtime;

import com.typesafe.config.ConfigFactory;
import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class RuntimeConfigTest {

    @Test
    void testDefaultsFromReferenceConf() {
        RuntimeConfig config = RuntimeConfig.defaults();

        assertTrue(config.multiThreaded());
        assertEquals(0, config.workerThreads());
        assertEquals("IO-runtime", config.effectiveThreadName());
        assertTrue(config.enableTime());
        assertEquals(Runtime.getRuntime().availableProcessors(), config.effectiveWorkerThreads());
    }

    @Test
    void testFromConfig_OverridesAndFallsBack() {
        RuntimeConfig config = RuntimeConfig.fromConfig(ConfigFactory.parseMap(Map.of(
                "worker-threads", 3,
                "thread-name", "table-io")));

        assertTrue(config.multiThreaded());
        assertEquals(3, config.effectiveWorkerThreads());
        assertEquals("table-io", config.effectiveThreadName());
    }

    @Test
    void testSingleThreadedUsesOneWorker() {
        RuntimeConfig config = new RuntimeConfig(false, 8, null, true, true);
        assertEquals(1, config.effectiveWorkerThreads());
        assertEquals(RuntimeConfig.DEFAULT_THREAD_NAME, config.effectiveThreadName());
    }

    @Test
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new RuntimeConfig(true, -1, null, true, true));
        assertThrows(IllegalArgumentException.class, () -> new RuntimeConfig(true, 1, " ", true, true));
    }
}
