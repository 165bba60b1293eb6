package org.deltaio.storage.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Source of the executor that {@link org.deltaio.storage.stores.wrappers.DeltaIOStorageBackend}
 * dispatches store operations onto.
 * <p>
 * An instance either carries an explicit executor supplied by the caller, or a
 * {@link RuntimeConfig} from which an executor is built on first use. Executors built
 * from a configuration are shared process-wide: the same configuration value always
 * yields the same executor, and different values yield independent executors. The
 * default context is built from {@link RuntimeConfig#defaults()} once and shared by all
 * callers of {@link #defaultRuntime()}.
 * <p>
 * Built executors run daemon threads named {@code <threadName>-<n>}. Nothing evicts them
 * automatically: every distinct configuration keeps a live pool for the rest of the
 * process unless {@link #release()} is called for it. The default context is never
 * released.
 */
public final class IORuntime {

    private static final Logger log = LoggerFactory.getLogger(IORuntime.class);

    private static final Map<RuntimeConfig, ExecutorService> BUILT = new ConcurrentHashMap<>();

    private final ExecutorService handle;
    private final RuntimeConfig config;

    private IORuntime(ExecutorService handle, RuntimeConfig config) {
        this.handle = handle;
        this.config = config;
    }

    /**
     * Uses an existing executor. Its lifecycle stays with the caller.
     */
    public static IORuntime of(ExecutorService handle) {
        return new IORuntime(Objects.requireNonNull(handle, "handle cannot be null"), null);
    }

    /**
     * Builds (or reuses) the executor for {@code config} lazily on {@link #getHandle()}.
     */
    public static IORuntime fromConfig(RuntimeConfig config) {
        return new IORuntime(null, Objects.requireNonNull(config, "config cannot be null"));
    }

    /**
     * Returns the process-wide default runtime.
     */
    public static IORuntime defaultRuntime() {
        return DefaultHolder.INSTANCE;
    }

    /**
     * Returns the executor of this runtime, building it on first use.
     *
     * @return the executor that runs dispatched work
     */
    public ExecutorService getHandle() {
        if (handle != null) {
            return handle;
        }
        return BUILT.computeIfAbsent(config, IORuntime::build);
    }

    static ExecutorService build(RuntimeConfig config) {
        int threads = config.effectiveWorkerThreads();
        ThreadFactory threadFactory = new NamedDaemonThreadFactory(config.effectiveThreadName());
        ExecutorService executor;
        if (config.enableTime()) {
            executor = new ScheduledThreadPoolExecutor(threads, threadFactory);
        } else {
            executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), threadFactory);
        }
        log.info("Created IO runtime '{}' with {} worker thread(s)", config.effectiveThreadName(), threads);
        return executor;
    }

    /**
     * Shuts down and forgets the executor built for this runtime's configuration. Backends
     * still holding the old executor get {@link org.deltaio.storage.api.JoinException}s; a
     * later {@link #getHandle()} builds a fresh executor. Runtimes over an explicit executor
     * are left alone, since the caller owns that executor.
     *
     * @return true if an executor was shut down
     * @throws IllegalStateException if this runtime uses the default configuration
     */
    public boolean release() {
        if (config == null) {
            return false;
        }
        if (config.equals(DefaultHolder.INSTANCE.config)) {
            throw new IllegalStateException("The default IO runtime cannot be released");
        }
        ExecutorService executor = BUILT.remove(config);
        if (executor == null) {
            return false;
        }
        executor.shutdown();
        log.info("Released IO runtime '{}'", config.effectiveThreadName());
        return true;
    }

    @Override
    public String toString() {
        return handle != null ? "IORuntime(handle)" : "IORuntime(" + config + ")";
    }

    private static final class DefaultHolder {
        private static final IORuntime INSTANCE = IORuntime.fromConfig(RuntimeConfig.defaults());
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        NamedDaemonThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
