package org.deltaio.storage.runtime;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Describes how to build an isolated execution context.
 * <p>
 * Loaded from the {@code deltaio.storage.io-runtime} section of {@code reference.conf}
 * (overridable in {@code application.conf}):
 * <pre>
 * io-runtime {
 *   multi-threaded = true
 *   worker-threads = 0        # 0 = one per available processor
 *   thread-name = "IO-runtime"
 *   enable-io = true
 *   enable-time = true
 * }
 * </pre>
 *
 * @param multiThreaded {@code false} runs all work on a single worker thread
 * @param workerThreads the worker count for multi-threaded contexts, 0 for one per processor
 * @param threadName    the worker name prefix, {@code null} for {@value #DEFAULT_THREAD_NAME}
 * @param enableIo      accepted for configuration compatibility, has no effect
 * @param enableTime    {@code true} builds a scheduling-capable executor
 */
public record RuntimeConfig(boolean multiThreaded, int workerThreads, String threadName,
                            boolean enableIo, boolean enableTime) {

    public static final String CONFIG_PATH = "deltaio.storage.io-runtime";
    public static final String DEFAULT_THREAD_NAME = "IO-runtime";

    public RuntimeConfig {
        if (workerThreads < 0) {
            throw new IllegalArgumentException("workerThreads cannot be negative, got " + workerThreads);
        }
        if (threadName != null && threadName.isBlank()) {
            throw new IllegalArgumentException("threadName cannot be blank");
        }
    }

    /**
     * Returns the configuration from {@code reference.conf} and {@code application.conf}.
     */
    public static RuntimeConfig defaults() {
        return fromConfig(ConfigFactory.load().getConfig(CONFIG_PATH));
    }

    /**
     * Reads a configuration section, falling back to the library defaults for missing keys.
     *
     * @param config the {@code io-runtime} section
     * @return the runtime configuration
     */
    public static RuntimeConfig fromConfig(Config config) {
        Config merged = config.withFallback(ConfigFactory.defaultReference().getConfig(CONFIG_PATH));
        return new RuntimeConfig(
                merged.getBoolean("multi-threaded"),
                merged.getInt("worker-threads"),
                merged.hasPath("thread-name") ? merged.getString("thread-name") : null,
                merged.getBoolean("enable-io"),
                merged.getBoolean("enable-time"));
    }

    /**
     * Returns the number of worker threads the context will run.
     */
    public int effectiveWorkerThreads() {
        if (!multiThreaded) {
            return 1;
        }
        return workerThreads > 0 ? workerThreads : Runtime.getRuntime().availableProcessors();
    }

    public String effectiveThreadName() {
        return threadName != null ? threadName : DEFAULT_THREAD_NAME;
    }
}
