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

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Rebases every path of the wrapped store under a fixed prefix.
 * <p>
 * Paths passed in are prefixed before delegation; paths reported back (metadata,
 * listings) have the prefix stripped, so callers never see it. A store wrapped with
 * prefix {@code "tables/t1"} stores {@code "_delta_log/0.json"} at
 * {@code "tables/t1/_delta_log/0.json"} of the inner store.
 */
public class PrefixObjectStore implements WrappedObjectStore {

    private final ObjectStore inner;
    private final ObjectPath prefix;

    public PrefixObjectStore(ObjectStore inner, ObjectPath prefix) {
        this.inner = Objects.requireNonNull(inner, "inner store cannot be null");
        this.prefix = Objects.requireNonNull(prefix, "prefix cannot be null");
    }

    @Override
    public ObjectStore inner() {
        return inner;
    }

    public ObjectPath getPrefix() {
        return prefix;
    }

    private ObjectPath fullPath(ObjectPath location) {
        return location == null ? prefix : prefix.join(location);
    }

    private ObjectPath stripPrefix(ObjectPath path) {
        return path.stripPrefix(prefix).orElse(path);
    }

    private ObjectMeta stripMeta(ObjectMeta meta) {
        return meta.withLocation(stripPrefix(meta.location()));
    }

    @Override
    public PutResult put(ObjectPath location, byte[] payload) throws ObjectStoreException {
        return inner.put(fullPath(location), payload);
    }

    @Override
    public PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException {
        return inner.putOpts(fullPath(location), payload, options);
    }

    @Override
    public MultipartUpload putMultipart(ObjectPath location) throws ObjectStoreException {
        return inner.putMultipart(fullPath(location));
    }

    @Override
    public MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) throws ObjectStoreException {
        return inner.putMultipartOpts(fullPath(location), options);
    }

    @Override
    public GetResult get(ObjectPath location) throws ObjectStoreException {
        GetResult result = inner.get(fullPath(location));
        return result.withLocation(stripPrefix(result.meta().location()));
    }

    @Override
    public GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException {
        GetResult result = inner.getOpts(fullPath(location), options);
        return result.withLocation(stripPrefix(result.meta().location()));
    }

    @Override
    public byte[] getRange(ObjectPath location, long start, long end) throws ObjectStoreException {
        return inner.getRange(fullPath(location), start, end);
    }

    @Override
    public ObjectMeta head(ObjectPath location) throws ObjectStoreException {
        return stripMeta(inner.head(fullPath(location)));
    }

    @Override
    public void delete(ObjectPath location) throws ObjectStoreException {
        inner.delete(fullPath(location));
    }

    @Override
    public Stream<ObjectMeta> list(ObjectPath listPrefix) {
        return inner.list(fullPath(listPrefix)).map(this::stripMeta);
    }

    @Override
    public Stream<ObjectMeta> listWithOffset(ObjectPath listPrefix, ObjectPath offset) {
        return inner.listWithOffset(fullPath(listPrefix), fullPath(offset)).map(this::stripMeta);
    }

    @Override
    public ListResult listWithDelimiter(ObjectPath listPrefix) throws ObjectStoreException {
        ListResult result = inner.listWithDelimiter(fullPath(listPrefix));
        List<ObjectPath> commonPrefixes = result.commonPrefixes().stream()
                .map(this::stripPrefix)
                .collect(Collectors.toList());
        List<ObjectMeta> objects = result.objects().stream()
                .map(this::stripMeta)
                .collect(Collectors.toList());
        return new ListResult(commonPrefixes, objects);
    }

    @Override
    public void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        inner.copy(fullPath(from), fullPath(to));
    }

    @Override
    public void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        inner.copyIfNotExists(fullPath(from), fullPath(to));
    }

    @Override
    public void rename(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        inner.rename(fullPath(from), fullPath(to));
    }

    @Override
    public void renameIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        inner.renameIfNotExists(fullPath(from), fullPath(to));
    }

    @Override
    public String toString() {
        return "PrefixObjectStore(" + prefix + ")";
    }
}
