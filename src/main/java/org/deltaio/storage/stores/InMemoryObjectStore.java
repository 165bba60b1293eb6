package org.deltaio.storage.stores;

import org.deltaio.storage.api.AlreadyExistsException;
import org.deltaio.storage.api.ByteRange;
import org.deltaio.storage.api.GetOptions;
import org.deltaio.storage.api.GetResult;
import org.deltaio.storage.api.ListResult;
import org.deltaio.storage.api.MultipartUpload;
import org.deltaio.storage.api.NotFoundException;
import org.deltaio.storage.api.NotSupportedException;
import org.deltaio.storage.api.ObjectMeta;
import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreException;
import org.deltaio.storage.api.PreconditionFailedException;
import org.deltaio.storage.api.PutMode;
import org.deltaio.storage.api.PutMultipartOptions;
import org.deltaio.storage.api.PutOptions;
import org.deltaio.storage.api.PutResult;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Stream;

/**
 * Ephemeral, process-local object store backed by a concurrent sorted map.
 * <p>
 * Every write assigns a fresh, monotonically increasing entity tag, so conditional
 * updates ({@link PutMode#update(String, String)}) and {@code ifMatch} reads work as
 * they would against a cloud store. Objects are not versioned.
 * <p>
 * <strong>Thread Safety:</strong> All operations are safe for concurrent use. Listings
 * are weakly consistent: they reflect some state of the store during iteration.
 */
public class InMemoryObjectStore implements ObjectStore {

    private final ConcurrentSkipListMap<ObjectPath, Entry> storage = new ConcurrentSkipListMap<>();
    private final AtomicLong nextETag = new AtomicLong(0);

    @Override
    public PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException {
        Entry entry = newEntry(payload.clone(), options.attributes());
        PutMode mode = options.mode();
        switch (mode.kind()) {
            case OVERWRITE:
                storage.put(location, entry);
                break;
            case CREATE:
                if (storage.putIfAbsent(location, entry) != null) {
                    throw new AlreadyExistsException("Object already exists at " + location);
                }
                break;
            case UPDATE:
                while (true) {
                    Entry current = storage.get(location);
                    if (current == null) {
                        throw new PreconditionFailedException("Object at " + location + " does not exist");
                    }
                    if (!Long.toString(current.eTag).equals(mode.expectedETag())) {
                        throw new PreconditionFailedException(String.format(
                                "%s does not match %s for %s", current.eTag, mode.expectedETag(), location));
                    }
                    if (storage.replace(location, current, entry)) {
                        break;
                    }
                }
                break;
            default:
                throw new NotSupportedException("Unsupported put mode: " + mode.kind());
        }
        return new PutResult(Long.toString(entry.eTag), null);
    }

    @Override
    public MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) {
        return new InMemoryUpload(location, options.attributes());
    }

    @Override
    public GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException {
        if (options.version() != null) {
            throw new NotSupportedException("InMemory does not support versioned reads of " + location);
        }
        Entry entry = entryOrThrow(location);
        ObjectMeta meta = entry.meta(location);
        options.checkPreconditions(meta);

        if (options.head()) {
            return new GetResult(meta, new ByteRange(0, meta.size()), new byte[0]);
        }
        ByteRange range = options.range() == null
                ? new ByteRange(0, entry.data.length)
                : options.range().resolve(entry.data.length);
        byte[] payload = Arrays.copyOfRange(entry.data, (int) range.start(), (int) range.end());
        return new GetResult(meta, range, payload);
    }

    @Override
    public void delete(ObjectPath location) {
        storage.remove(location);
    }

    @Override
    public Stream<ObjectMeta> list(ObjectPath prefix) {
        ObjectPath base = prefix == null ? ObjectPath.root() : prefix;
        return entriesUnder(base).map(e -> e.getValue().meta(e.getKey()));
    }

    @Override
    public ListResult listWithDelimiter(ObjectPath prefix) {
        ObjectPath base = prefix == null ? ObjectPath.root() : prefix;
        TreeSet<ObjectPath> commonPrefixes = new TreeSet<>();
        List<ObjectMeta> objects = new ArrayList<>();

        entriesUnder(base).forEach(e -> {
            List<String> rest = e.getKey().stripPrefix(base).orElseThrow().parts();
            if (rest.size() == 1) {
                objects.add(e.getValue().meta(e.getKey()));
            } else {
                commonPrefixes.add(base.child(rest.get(0)));
            }
        });
        return new ListResult(new ArrayList<>(commonPrefixes), objects);
    }

    @Override
    public void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        Entry source = entryOrThrow(from);
        storage.put(to, newEntry(source.data, source.attributes));
    }

    @Override
    public void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        Entry source = entryOrThrow(from);
        if (storage.putIfAbsent(to, newEntry(source.data, source.attributes)) != null) {
            throw new AlreadyExistsException("Object already exists at " + to);
        }
    }

    private Entry entryOrThrow(ObjectPath location) throws NotFoundException {
        Entry entry = storage.get(location);
        if (entry == null) {
            throw new NotFoundException("Object not found at " + location);
        }
        return entry;
    }

    // Keys sharing a path prefix are contiguous in string order, so the scan can stop at
    // the first key that no longer starts with the raw prefix.
    private Stream<Map.Entry<ObjectPath, Entry>> entriesUnder(ObjectPath base) {
        String raw = base.asString();
        return storage.tailMap(base, true).entrySet().stream()
                .takeWhile(e -> e.getKey().asString().startsWith(raw))
                .filter(e -> e.getKey().isStrictlyUnder(base));
    }

    private Entry newEntry(byte[] data, Map<String, String> attributes) {
        return new Entry(data, Instant.now(), attributes, nextETag.getAndIncrement());
    }

    @Override
    public String toString() {
        return "InMemory";
    }

    private static final class Entry {
        final byte[] data;
        final Instant lastModified;
        final Map<String, String> attributes;
        final long eTag;

        Entry(byte[] data, Instant lastModified, Map<String, String> attributes, long eTag) {
            this.data = data;
            this.lastModified = lastModified;
            this.attributes = attributes;
            this.eTag = eTag;
        }

        ObjectMeta meta(ObjectPath location) {
            return new ObjectMeta(location, lastModified, data.length, Long.toString(eTag), null);
        }
    }

    private final class InMemoryUpload implements MultipartUpload {
        private final ObjectPath location;
        private final Map<String, String> attributes;
        private final List<byte[]> parts = new ArrayList<>();

        InMemoryUpload(ObjectPath location, Map<String, String> attributes) {
            this.location = Objects.requireNonNull(location);
            this.attributes = attributes;
        }

        @Override
        public synchronized void putPart(byte[] data) {
            parts.add(data.clone());
        }

        @Override
        public synchronized PutResult complete() {
            ByteArrayOutputStream assembled = new ByteArrayOutputStream();
            for (byte[] part : parts) {
                assembled.writeBytes(part);
            }
            parts.clear();
            Entry entry = newEntry(assembled.toByteArray(), attributes);
            storage.put(location, entry);
            return new PutResult(Long.toString(entry.eTag), null);
        }

        @Override
        public synchronized void abort() {
            parts.clear();
        }
    }
}
