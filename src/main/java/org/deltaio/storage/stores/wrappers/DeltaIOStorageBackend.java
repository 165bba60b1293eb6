package org.deltaio.storage.stores.wrappers;

import org.deltaio.storage.api.GetOptions;
import org.deltaio.storage.api.GetResult;
import org.deltaio.storage.api.JoinException;
import org.deltaio.storage.api.ListResult;
import org.deltaio.storage.api.MultipartUpload;
import org.deltaio.storage.api.ObjectMeta;
import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreException;
import org.deltaio.storage.api.PutMultipartOptions;
import org.deltaio.storage.api.PutOptions;
import org.deltaio.storage.api.PutResult;
import org.deltaio.storage.api.WrappedObjectStore;
import org.deltaio.storage.runtime.IORuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

/**
 * Runs every request of the wrapped store on a dedicated executor.
 * <p>
 * The calling thread submits the request and blocks until it completes. Outcomes are
 * mapped as follows:
 * <ul>
 *   <li>success: the result is returned unchanged</li>
 *   <li>{@link ObjectStoreException} thrown by the inner store: rethrown unchanged</li>
 *   <li>{@link RuntimeException} or {@link Error} thrown by the inner store: rethrown
 *       unchanged on the calling thread</li>
 *   <li>rejected submission, cancelled task, or an interrupt of the waiting caller:
 *       {@link JoinException}</li>
 * </ul>
 * An interrupted caller stops waiting but the submitted request keeps running.
 * <p>
 * A request issued from a task this class already dispatched onto the same executor runs
 * inline on that worker. Nested backends sharing one executor would otherwise wait on a
 * task that can never be scheduled.
 * <p>
 * Listing streams are produced lazily on the caller's thread and are not dispatched.
 */
public class DeltaIOStorageBackend implements WrappedObjectStore {

    private static final Logger log = LoggerFactory.getLogger(DeltaIOStorageBackend.class);

    /**
     * A request on one path.
     */
    @FunctionalInterface
    public interface PathOperation<T> {
        T apply(ObjectStore store, ObjectPath path) throws ObjectStoreException;
    }

    /**
     * A request from one path to another.
     */
    @FunctionalInterface
    public interface FromToOperation<T> {
        T apply(ObjectStore store, ObjectPath from, ObjectPath to) throws ObjectStoreException;
    }

    @FunctionalInterface
    private interface StoreCall<T> {
        T call() throws ObjectStoreException;
    }

    /** Executor whose dispatched task is running on the current thread, if any. */
    private static final ThreadLocal<ExecutorService> DISPATCHED_ON = new ThreadLocal<>();

    private final ObjectStore inner;
    private final ExecutorService handle;

    public DeltaIOStorageBackend(ObjectStore inner, ExecutorService handle) {
        this.inner = Objects.requireNonNull(inner, "inner store cannot be null");
        this.handle = Objects.requireNonNull(handle, "handle cannot be null");
    }

    public DeltaIOStorageBackend(ObjectStore inner, IORuntime runtime) {
        this(inner, runtime.getHandle());
    }

    @Override
    public ObjectStore inner() {
        return inner;
    }

    /**
     * Runs {@code operation} against the given store on this backend's executor.
     *
     * @return the operation's result
     * @throws ObjectStoreException the operation's own failure, or a {@link JoinException}
     *                              if its outcome could not be obtained
     */
    public <T> T spawnIoRt(PathOperation<T> operation, ObjectStore store, ObjectPath path)
            throws ObjectStoreException {
        return dispatch(() -> operation.apply(store, path), path);
    }

    /**
     * Two-path variant of {@link #spawnIoRt}, used by copy and rename.
     */
    public <T> T spawnIoRtFromTo(FromToOperation<T> operation, ObjectStore store, ObjectPath from, ObjectPath to)
            throws ObjectStoreException {
        return dispatch(() -> operation.apply(store, from, to), from);
    }

    private <T> T dispatch(StoreCall<T> call, ObjectPath path) throws ObjectStoreException {
        if (DISPATCHED_ON.get() == handle) {
            return call.call();
        }
        return await(submit(() -> runDispatched(call), path));
    }

    private <T> T runDispatched(StoreCall<T> call) throws ObjectStoreException {
        ExecutorService previous = DISPATCHED_ON.get();
        DISPATCHED_ON.set(handle);
        try {
            return call.call();
        } finally {
            if (previous == null) {
                DISPATCHED_ON.remove();
            } else {
                DISPATCHED_ON.set(previous);
            }
        }
    }

    private <T> Future<T> submit(Callable<T> task, ObjectPath path) throws JoinException {
        try {
            return handle.submit(task);
        } catch (RejectedExecutionException e) {
            throw new JoinException("IO runtime rejected request for " + path, e);
        }
    }

    private static <T> T await(Future<T> future) throws ObjectStoreException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new JoinException("Interrupted while waiting for IO runtime", e);
        } catch (CancellationException e) {
            throw new JoinException("IO runtime task was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ObjectStoreException) {
                throw (ObjectStoreException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            log.debug("IO runtime task failed with unexpected checked exception", cause);
            throw new JoinException("IO runtime task failed: " + cause, cause);
        }
    }

    @Override
    public PutResult put(ObjectPath location, byte[] payload) throws ObjectStoreException {
        return spawnIoRt((store, path) -> store.put(path, payload), inner, location);
    }

    @Override
    public PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException {
        return spawnIoRt((store, path) -> store.putOpts(path, payload, options), inner, location);
    }

    @Override
    public MultipartUpload putMultipart(ObjectPath location) throws ObjectStoreException {
        return spawnIoRt(ObjectStore::putMultipart, inner, location);
    }

    @Override
    public MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) throws ObjectStoreException {
        return spawnIoRt((store, path) -> store.putMultipartOpts(path, options), inner, location);
    }

    @Override
    public GetResult get(ObjectPath location) throws ObjectStoreException {
        return spawnIoRt(ObjectStore::get, inner, location);
    }

    @Override
    public GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException {
        return spawnIoRt((store, path) -> store.getOpts(path, options), inner, location);
    }

    @Override
    public byte[] getRange(ObjectPath location, long start, long end) throws ObjectStoreException {
        return spawnIoRt((store, path) -> store.getRange(path, start, end), inner, location);
    }

    @Override
    public ObjectMeta head(ObjectPath location) throws ObjectStoreException {
        return spawnIoRt(ObjectStore::head, inner, location);
    }

    @Override
    public void delete(ObjectPath location) throws ObjectStoreException {
        spawnIoRt((store, path) -> {
            store.delete(path);
            return null;
        }, inner, location);
    }

    @Override
    public Stream<ObjectMeta> list(ObjectPath prefix) {
        return inner.list(prefix);
    }

    @Override
    public Stream<ObjectMeta> listWithOffset(ObjectPath prefix, ObjectPath offset) {
        return inner.listWithOffset(prefix, offset);
    }

    @Override
    public ListResult listWithDelimiter(ObjectPath prefix) throws ObjectStoreException {
        return inner.listWithDelimiter(prefix);
    }

    @Override
    public void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        spawnIoRtFromTo((store, f, t) -> {
            store.copy(f, t);
            return null;
        }, inner, from, to);
    }

    @Override
    public void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        spawnIoRtFromTo((store, f, t) -> {
            store.copyIfNotExists(f, t);
            return null;
        }, inner, from, to);
    }

    @Override
    public void rename(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        spawnIoRtFromTo((store, f, t) -> {
            store.rename(f, t);
            return null;
        }, inner, from, to);
    }

    @Override
    public void renameIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        spawnIoRtFromTo((store, f, t) -> {
            store.renameIfNotExists(f, t);
            return null;
        }, inner, from, to);
    }

    @Override
    public String toString() {
        return "DeltaIOStorageBackend";
    }
}
