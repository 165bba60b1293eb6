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

import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.stream.Stream;

/**
 * Bounds the number of concurrent requests issued against the wrapped store.
 * <p>
 * Every operation holds one permit of a fair {@link Semaphore} for its duration. A listing
 * stream holds its permit until the stream is closed, and each call on a multipart upload
 * acquires its own permit.
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe.
 */
public class LimitObjectStore implements WrappedObjectStore {

    @FunctionalInterface
    private interface Call<T> {
        T call() throws ObjectStoreException;
    }

    private final ObjectStore inner;
    private final int maxRequests;
    private final Semaphore permits;

    /**
     * @param inner       the store to limit
     * @param maxRequests the maximum number of in-flight requests, at least 1
     */
    public LimitObjectStore(ObjectStore inner, int maxRequests) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive, got " + maxRequests);
        }
        this.inner = Objects.requireNonNull(inner, "inner store cannot be null");
        this.maxRequests = maxRequests;
        this.permits = new Semaphore(maxRequests, true);
    }

    @Override
    public ObjectStore inner() {
        return inner;
    }

    public int getMaxRequests() {
        return maxRequests;
    }

    /**
     * Returns the number of permits currently not held by any request.
     *
     * @return the free permits
     */
    public int availablePermits() {
        return permits.availablePermits();
    }

    private void acquire(String operation) throws ObjectStoreException {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ObjectStoreException("Interrupted while waiting for a request permit for " + operation, e);
        }
    }

    private <T> T withPermit(String operation, Call<T> call) throws ObjectStoreException {
        acquire(operation);
        try {
            return call.call();
        } finally {
            permits.release();
        }
    }

    private Stream<ObjectMeta> limitedStream(String operation, Call<Stream<ObjectMeta>> call) {
        try {
            acquire(operation);
        } catch (ObjectStoreException e) {
            throw new UncheckedIOException(e);
        }
        Stream<ObjectMeta> stream;
        try {
            stream = call.call();
        } catch (ObjectStoreException e) {
            permits.release();
            throw new UncheckedIOException(e);
        } catch (RuntimeException | Error e) {
            permits.release();
            throw e;
        }
        return stream.onClose(permits::release);
    }

    @Override
    public PutResult put(ObjectPath location, byte[] payload) throws ObjectStoreException {
        return withPermit("put", () -> inner.put(location, payload));
    }

    @Override
    public PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException {
        return withPermit("put", () -> inner.putOpts(location, payload, options));
    }

    @Override
    public MultipartUpload putMultipart(ObjectPath location) throws ObjectStoreException {
        return new LimitUpload(withPermit("multipart", () -> inner.putMultipart(location)));
    }

    @Override
    public MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) throws ObjectStoreException {
        return new LimitUpload(withPermit("multipart", () -> inner.putMultipartOpts(location, options)));
    }

    @Override
    public GetResult get(ObjectPath location) throws ObjectStoreException {
        return withPermit("get", () -> inner.get(location));
    }

    @Override
    public GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException {
        return withPermit("get", () -> inner.getOpts(location, options));
    }

    @Override
    public byte[] getRange(ObjectPath location, long start, long end) throws ObjectStoreException {
        return withPermit("get_range", () -> inner.getRange(location, start, end));
    }

    @Override
    public ObjectMeta head(ObjectPath location) throws ObjectStoreException {
        return withPermit("head", () -> inner.head(location));
    }

    @Override
    public void delete(ObjectPath location) throws ObjectStoreException {
        withPermit("delete", () -> {
            inner.delete(location);
            return null;
        });
    }

    @Override
    public Stream<ObjectMeta> list(ObjectPath prefix) {
        return limitedStream("list", () -> inner.list(prefix));
    }

    @Override
    public Stream<ObjectMeta> listWithOffset(ObjectPath prefix, ObjectPath offset) {
        return limitedStream("list", () -> inner.listWithOffset(prefix, offset));
    }

    @Override
    public ListResult listWithDelimiter(ObjectPath prefix) throws ObjectStoreException {
        return withPermit("list", () -> inner.listWithDelimiter(prefix));
    }

    @Override
    public void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        withPermit("copy", () -> {
            inner.copy(from, to);
            return null;
        });
    }

    @Override
    public void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        withPermit("copy", () -> {
            inner.copyIfNotExists(from, to);
            return null;
        });
    }

    @Override
    public void rename(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        withPermit("rename", () -> {
            inner.rename(from, to);
            return null;
        });
    }

    @Override
    public void renameIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        withPermit("rename", () -> {
            inner.renameIfNotExists(from, to);
            return null;
        });
    }

    @Override
    public String toString() {
        return "LimitStore(" + maxRequests + ", " + inner + ")";
    }

    private final class LimitUpload implements MultipartUpload {

        private final MultipartUpload upload;

        LimitUpload(MultipartUpload upload) {
            this.upload = upload;
        }

        @Override
        public void putPart(byte[] data) throws ObjectStoreException {
            withPermit("put_part", () -> {
                upload.putPart(data);
                return null;
            });
        }

        @Override
        public PutResult complete() throws ObjectStoreException {
            return withPermit("complete", upload::complete);
        }

        @Override
        public void abort() throws ObjectStoreException {
            withPermit("abort", () -> {
                upload.abort();
                return null;
            });
        }
    }
}
