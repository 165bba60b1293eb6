package org.deltaio.storage.stores.wrappers;

import org.deltaio.storage.api.GetOptions;
import org.deltaio.storage.api.GetResult;
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
import org.deltaio.storage.config.Backoff;
import org.deltaio.storage.config.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Retries requests that fail with a transient {@link ObjectStoreException}.
 * <p>
 * Delays follow a jittered exponential {@link Backoff}. Retrying stops after
 * {@link RetryConfig#maxRetries()} retries or once {@link RetryConfig#retryTimeout()} has
 * elapsed, whichever comes first, and the last failure is thrown. Non-transient failures
 * (not found, precondition failed, ...) are thrown immediately.
 * <p>
 * Listing streams and the parts of a multipart upload are not retried.
 */
public class RetryObjectStore implements WrappedObjectStore {

    private static final Logger log = LoggerFactory.getLogger(RetryObjectStore.class);

    @FunctionalInterface
    private interface Call<T> {
        T call() throws ObjectStoreException;
    }

    private final ObjectStore inner;
    private final RetryConfig config;

    public RetryObjectStore(ObjectStore inner, RetryConfig config) {
        this.inner = Objects.requireNonNull(inner, "inner store cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
    }

    @Override
    public ObjectStore inner() {
        return inner;
    }

    public RetryConfig getConfig() {
        return config;
    }

    private <T> T retry(String operation, Object target, Call<T> call) throws ObjectStoreException {
        Backoff backoff = new Backoff(config.backoff());
        long startNanos = System.nanoTime();
        int retries = 0;
        while (true) {
            try {
                return call.call();
            } catch (ObjectStoreException e) {
                Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                if (!e.isTransient() || retries >= config.maxRetries()
                        || elapsed.compareTo(config.retryTimeout()) >= 0) {
                    throw e;
                }
                retries++;
                Duration delay = backoff.next();
                log.debug("{} of {} failed, retry {}/{} in {}ms: {}",
                        operation, target, retries, config.maxRetries(), delay.toMillis(), e.getMessage());
                try {
                    Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(ie);
                    throw e;
                }
            }
        }
    }

    @Override
    public PutResult put(ObjectPath location, byte[] payload) throws ObjectStoreException {
        return retry("put", location, () -> inner.put(location, payload));
    }

    @Override
    public PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException {
        return retry("put", location, () -> inner.putOpts(location, payload, options));
    }

    @Override
    public MultipartUpload putMultipart(ObjectPath location) throws ObjectStoreException {
        return retry("put_multipart", location, () -> inner.putMultipart(location));
    }

    @Override
    public MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) throws ObjectStoreException {
        return retry("put_multipart", location, () -> inner.putMultipartOpts(location, options));
    }

    @Override
    public GetResult get(ObjectPath location) throws ObjectStoreException {
        return retry("get", location, () -> inner.get(location));
    }

    @Override
    public GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException {
        return retry("get", location, () -> inner.getOpts(location, options));
    }

    @Override
    public byte[] getRange(ObjectPath location, long start, long end) throws ObjectStoreException {
        return retry("get_range", location, () -> inner.getRange(location, start, end));
    }

    @Override
    public ObjectMeta head(ObjectPath location) throws ObjectStoreException {
        return retry("head", location, () -> inner.head(location));
    }

    @Override
    public void delete(ObjectPath location) throws ObjectStoreException {
        retry("delete", location, () -> {
            inner.delete(location);
            return null;
        });
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
        return retry("list_with_delimiter", prefix, () -> inner.listWithDelimiter(prefix));
    }

    @Override
    public void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        retry("copy", from, () -> {
            inner.copy(from, to);
            return null;
        });
    }

    @Override
    public void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        retry("copy_if_not_exists", from, () -> {
            inner.copyIfNotExists(from, to);
            return null;
        });
    }

    @Override
    public void rename(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        retry("rename", from, () -> {
            inner.rename(from, to);
            return null;
        });
    }

    @Override
    public void renameIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        retry("rename_if_not_exists", from, () -> {
            inner.renameIfNotExists(from, to);
            return null;
        });
    }

    @Override
    public String toString() {
        return "RetryStore(" + inner + ")";
    }
}
