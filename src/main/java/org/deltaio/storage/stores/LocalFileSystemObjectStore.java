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
import org.deltaio.storage.api.PutMode;
import org.deltaio.storage.api.PutMultipartOptions;
import org.deltaio.storage.api.PutOptions;
import org.deltaio.storage.api.PutResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Object store over a directory of the local filesystem.
 * <p>
 * Object paths map part by part onto files below the root directory. Writes go to a
 * staging file next to the target ({@code <name>.<uuid>.tmp}) which is then moved into
 * place atomically, so readers never observe partial objects. Staging files are hidden
 * from listings.
 * <p>
 * Create-only writes and {@link #copyIfNotExists}/{@link #renameIfNotExists} rely on hard
 * links; on filesystems without hard links they fall back to a non-replacing move or
 * copy. Conditional updates ({@link PutMode.Kind#UPDATE}) are not supported.
 * <p>
 * Deleting a missing object fails with {@link NotFoundException}.
 */
public class LocalFileSystemObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(LocalFileSystemObjectStore.class);

    private static final Pattern STAGING_FILE =
            Pattern.compile(".+\\.[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\.tmp");

    private final Path root;

    private LocalFileSystemObjectStore(Path root) {
        this.root = root;
    }

    /**
     * Creates a store rooted at {@code prefix}, creating the directory if it is missing.
     *
     * @param prefix the absolute root directory
     * @return the store
     * @throws IllegalArgumentException if {@code prefix} is not absolute
     * @throws ObjectStoreException     if the directory cannot be created or is not a directory
     */
    public static LocalFileSystemObjectStore newWithPrefix(Path prefix) throws ObjectStoreException {
        if (!prefix.isAbsolute()) {
            throw new IllegalArgumentException("Root directory must be an absolute path: " + prefix);
        }
        Path normalized = prefix.normalize();
        try {
            Files.createDirectories(normalized);
        } catch (IOException e) {
            throw new ObjectStoreException("Failed to create root directory " + normalized, e);
        }
        if (!Files.isDirectory(normalized)) {
            throw new ObjectStoreException("Root is not a directory: " + normalized);
        }
        return new LocalFileSystemObjectStore(normalized);
    }

    /**
     * Returns the root directory of this store.
     *
     * @return the absolute root directory
     */
    public Path getRoot() {
        return root;
    }

    @Override
    public PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException {
        PutMode mode = options.mode();
        if (mode.kind() == PutMode.Kind.UPDATE) {
            throw new NotSupportedException("Conditional update of " + location + " is not supported by " + this);
        }
        Path target = resolve(location);
        Path staged = null;
        try {
            staged = stage(target);
            Files.write(staged, payload);
            if (mode.kind() == PutMode.Kind.CREATE) {
                linkOrMove(staged, target);
            } else {
                Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
            }
        } catch (IOException e) {
            throw translate(e, "write", location);
        } finally {
            deleteStaged(staged);
        }
        return new PutResult(head(location).eTag(), null);
    }

    @Override
    public MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) throws ObjectStoreException {
        Path target = resolve(location);
        try {
            Path staged = stage(target);
            return new LocalUpload(location, target, staged, Files.newOutputStream(staged, StandardOpenOption.CREATE_NEW));
        } catch (IOException e) {
            throw translate(e, "start multipart upload to", location);
        }
    }

    @Override
    public GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException {
        if (options.version() != null) {
            throw new NotSupportedException("LocalFileSystem does not support versioned reads of " + location);
        }
        Path file = resolve(location);
        ObjectMeta meta = readMeta(location, file);
        options.checkPreconditions(meta);

        if (options.head()) {
            return new GetResult(meta, new ByteRange(0, meta.size()), new byte[0]);
        }
        ByteRange range = options.range() == null
                ? new ByteRange(0, meta.size())
                : options.range().resolve(meta.size());
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            ByteBuffer buffer = ByteBuffer.allocate((int) range.length());
            long position = range.start();
            while (buffer.hasRemaining()) {
                int read = channel.read(buffer, position);
                if (read < 0) {
                    throw new ObjectStoreException(String.format(
                            "Unexpected end of file reading %s at offset %d", location, position));
                }
                position += read;
            }
            return new GetResult(meta, range, buffer.array());
        } catch (IOException e) {
            throw translate(e, "read", location);
        }
    }

    @Override
    public void delete(ObjectPath location) throws ObjectStoreException {
        try {
            Files.delete(resolve(location));
        } catch (IOException e) {
            throw translate(e, "delete", location);
        }
    }

    @Override
    public Stream<ObjectMeta> list(ObjectPath prefix) {
        Path dir = prefix == null ? root : resolve(prefix);
        if (!Files.isDirectory(dir)) {
            return Stream.empty();
        }
        Stream<Path> walk;
        try {
            walk = Files.walk(dir);
        } catch (NoSuchFileException e) {
            return Stream.empty();
        } catch (IOException e) {
            throw new UncheckedIOException(translate(e, "list", prefix));
        }
        return walk
                // Filter staging files BEFORE checking isRegularFile to avoid races with in-flight writes
                .filter(p -> !isStagingFile(p))
                .filter(Files::isRegularFile)
                .map(this::metaIfPresent)
                .flatMap(Optional::stream);
    }

    @Override
    public ListResult listWithDelimiter(ObjectPath prefix) throws ObjectStoreException {
        ObjectPath base = prefix == null ? ObjectPath.root() : prefix;
        Path dir = resolve(base);
        if (!Files.isDirectory(dir)) {
            return new ListResult(List.of(), List.of());
        }
        TreeSet<ObjectPath> commonPrefixes = new TreeSet<>();
        List<ObjectMeta> objects = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            for (Path child : (Iterable<Path>) children::iterator) {
                String name = child.getFileName().toString();
                if (Files.isDirectory(child)) {
                    commonPrefixes.add(base.child(name));
                } else if (!isStagingFile(child) && Files.isRegularFile(child)) {
                    metaIfPresent(child).ifPresent(objects::add);
                }
            }
        } catch (IOException | UncheckedIOException e) {
            IOException cause = e instanceof UncheckedIOException ? ((UncheckedIOException) e).getCause() : (IOException) e;
            throw translate(cause, "list", base);
        }
        return new ListResult(new ArrayList<>(commonPrefixes), objects);
    }

    @Override
    public void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        Path source = resolve(from);
        Path target = resolve(to);
        Path staged = null;
        try {
            requireRegularFile(from, source);
            staged = stage(target);
            Files.copy(source, staged, StandardCopyOption.REPLACE_EXISTING);
            Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw translate(e, "copy " + from + " to", to);
        } finally {
            deleteStaged(staged);
        }
    }

    @Override
    public void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        Path source = resolve(from);
        Path target = resolve(to);
        try {
            requireRegularFile(from, source);
            Files.createDirectories(target.getParent());
            try {
                Files.createLink(target, source);
            } catch (UnsupportedOperationException e) {
                Files.copy(source, target);
            }
        } catch (IOException e) {
            throw translate(e, "copy " + from + " to", to);
        }
    }

    @Override
    public void rename(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        Path source = resolve(from);
        Path target = resolve(to);
        try {
            requireRegularFile(from, source);
            Files.createDirectories(target.getParent());
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw translate(e, "rename " + from + " to", to);
        }
    }

    @Override
    public void renameIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        copyIfNotExists(from, to);
        delete(from);
    }

    private Path resolve(ObjectPath location) {
        Path path = root;
        for (String part : location.parts()) {
            path = path.resolve(part);
        }
        return path;
    }

    private ObjectPath toLocation(Path file) {
        List<String> parts = new ArrayList<>();
        for (Path part : root.relativize(file)) {
            parts.add(part.toString());
        }
        return ObjectPath.fromParts(parts);
    }

    private ObjectMeta readMeta(ObjectPath location, Path file) throws ObjectStoreException {
        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(file, BasicFileAttributes.class);
        } catch (IOException e) {
            throw translate(e, "read", location);
        }
        if (!attributes.isRegularFile()) {
            throw new NotFoundException("Object not found at " + location + " (not a regular file)");
        }
        return toMeta(location, attributes);
    }

    private Optional<ObjectMeta> metaIfPresent(Path file) {
        try {
            BasicFileAttributes attributes = Files.readAttributes(file, BasicFileAttributes.class);
            return Optional.of(toMeta(toLocation(file), attributes));
        } catch (NoSuchFileException e) {
            // Deleted between directory scan and stat
            return Optional.empty();
        } catch (IOException e) {
            throw new UncheckedIOException(new ObjectStoreException("Failed to stat " + file, e));
        }
    }

    private static ObjectMeta toMeta(ObjectPath location, BasicFileAttributes attributes) {
        long modifiedMicros = attributes.lastModifiedTime().to(java.util.concurrent.TimeUnit.MICROSECONDS);
        String eTag = Long.toHexString(modifiedMicros) + "-" + Long.toHexString(attributes.size());
        return new ObjectMeta(location, attributes.lastModifiedTime().toInstant(), attributes.size(), eTag, null);
    }

    private static void requireRegularFile(ObjectPath location, Path file) throws NotFoundException {
        if (!Files.isRegularFile(file)) {
            throw new NotFoundException("Object not found at " + location);
        }
    }

    private static Path stage(Path target) throws IOException {
        Path parent = target.getParent();
        Files.createDirectories(parent);
        return parent.resolve(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
    }

    private static void linkOrMove(Path staged, Path target) throws IOException {
        try {
            Files.createLink(target, staged);
        } catch (UnsupportedOperationException e) {
            Files.move(staged, target);
        }
    }

    private static void deleteStaged(Path staged) {
        if (staged == null) {
            return;
        }
        try {
            Files.deleteIfExists(staged);
        } catch (IOException e) {
            log.warn("Failed to clean up staging file {}: {}", staged, e.getMessage());
        }
    }

    private static boolean isStagingFile(Path path) {
        Path name = path.getFileName();
        return name != null && STAGING_FILE.matcher(name.toString()).matches();
    }

    private static ObjectStoreException translate(IOException e, String action, ObjectPath location) {
        if (e instanceof ObjectStoreException) {
            return (ObjectStoreException) e;
        }
        if (e instanceof NoSuchFileException) {
            return new NotFoundException("Object not found at " + location, e);
        }
        if (e instanceof FileAlreadyExistsException) {
            return new AlreadyExistsException("Object already exists at " + location, e);
        }
        return new ObjectStoreException("Failed to " + action + " " + location + ": " + e.getMessage(), e);
    }

    @Override
    public String toString() {
        return "LocalFileSystem(" + root.toUri() + ")";
    }

    private final class LocalUpload implements MultipartUpload {
        private final ObjectPath location;
        private final Path target;
        private final Path staged;
        private final OutputStream out;
        private boolean closed;

        LocalUpload(ObjectPath location, Path target, Path staged, OutputStream out) {
            this.location = location;
            this.target = target;
            this.staged = staged;
            this.out = out;
        }

        @Override
        public synchronized void putPart(byte[] data) throws ObjectStoreException {
            ensureOpen();
            try {
                out.write(data);
            } catch (IOException e) {
                throw translate(e, "upload part to", location);
            }
        }

        @Override
        public synchronized PutResult complete() throws ObjectStoreException {
            ensureOpen();
            closed = true;
            try {
                out.close();
                Files.move(staged, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                deleteStaged(staged);
                throw translate(e, "complete multipart upload to", location);
            }
            return new PutResult(head(location).eTag(), null);
        }

        @Override
        public synchronized void abort() throws ObjectStoreException {
            if (closed) {
                return;
            }
            closed = true;
            try {
                out.close();
                Files.deleteIfExists(staged);
            } catch (IOException e) {
                throw translate(e, "abort multipart upload to", location);
            }
        }

        private void ensureOpen() throws ObjectStoreException {
            if (closed) {
                throw new ObjectStoreException("Multipart upload to " + location + " is already finished");
            }
        }
    }
}
