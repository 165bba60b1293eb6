package org.deltaio.storage.api;

import java.util.stream.Stream;

/**
 * Uniform capability contract of every storage backend.
 * <p>
 * Concrete backends (in-memory, local filesystem, cloud providers) and decorators
 * (prefixing, concurrency limiting, retrying, runtime isolation) all implement this
 * interface; a decorator owns another {@code ObjectStore} and re-exposes the same
 * operations.
 * <p>
 * <strong>Operations:</strong>
 * <ul>
 *   <li>Writes: {@link #put}, {@link #putOpts}, {@link #putMultipart}, {@link #putMultipartOpts}</li>
 *   <li>Reads: {@link #get}, {@link #getOpts}, {@link #getRange}, {@link #head}</li>
 *   <li>Listing: {@link #list}, {@link #listWithOffset}, {@link #listWithDelimiter}</li>
 *   <li>Mutation: {@link #delete}, {@link #copy}, {@link #copyIfNotExists}, {@link #rename},
 *       {@link #renameIfNotExists}</li>
 * </ul>
 * <p>
 * All operations block until done and report failures as {@link ObjectStoreException}.
 * Listing streams are lazy and may hold resources (open directories, concurrency
 * permits); callers must close them, typically with try-with-resources.
 * <p>
 * {@link Object#toString()} is the displayed identity of a backend, e.g.
 * {@code "LimitStore(500, InMemory)"}.
 * <p>
 * <strong>Thread Safety:</strong> Implementations must be safe for concurrent use.
 */
public interface ObjectStore {

    /**
     * Writes {@code payload} to {@code location}, replacing any existing object.
     *
     * @param location the target path
     * @param payload  the object contents
     * @return the result of the write
     * @throws ObjectStoreException if the write fails
     */
    default PutResult put(ObjectPath location, byte[] payload) throws ObjectStoreException {
        return putOpts(location, payload, PutOptions.defaults());
    }

    /**
     * Writes {@code payload} to {@code location} honouring the given {@link PutMode}.
     *
     * @param location the target path
     * @param payload  the object contents
     * @param options  the write options
     * @return the result of the write
     * @throws AlreadyExistsException      for {@link PutMode.Kind#CREATE} when the object exists
     * @throws PreconditionFailedException for {@link PutMode.Kind#UPDATE} on a version mismatch
     * @throws NotSupportedException       if the backend does not support the mode
     * @throws ObjectStoreException        if the write fails
     */
    PutResult putOpts(ObjectPath location, byte[] payload, PutOptions options) throws ObjectStoreException;

    /**
     * Starts a multipart upload to {@code location}.
     *
     * @param location the target path
     * @return the upload session
     * @throws ObjectStoreException if the session cannot be started
     */
    default MultipartUpload putMultipart(ObjectPath location) throws ObjectStoreException {
        return putMultipartOpts(location, PutMultipartOptions.defaults());
    }

    /**
     * Starts a multipart upload to {@code location} with options.
     *
     * @param location the target path
     * @param options  the upload options
     * @return the upload session
     * @throws ObjectStoreException if the session cannot be started
     */
    MultipartUpload putMultipartOpts(ObjectPath location, PutMultipartOptions options) throws ObjectStoreException;

    /**
     * Reads the whole object at {@code location}.
     *
     * @param location the path to read
     * @return the object contents and metadata
     * @throws NotFoundException    if there is no object at {@code location}
     * @throws ObjectStoreException if the read fails
     */
    default GetResult get(ObjectPath location) throws ObjectStoreException {
        return getOpts(location, GetOptions.defaults());
    }

    /**
     * Reads the object at {@code location} honouring conditions and ranges.
     *
     * @param location the path to read
     * @param options  the read options
     * @return the requested contents and metadata
     * @throws NotFoundException           if there is no object at {@code location}
     * @throws PreconditionFailedException if an {@code ifMatch}/{@code ifUnmodifiedSince} condition fails
     * @throws NotModifiedException        if an {@code ifNoneMatch}/{@code ifModifiedSince} condition fails
     * @throws InvalidRangeException       if the range cannot be satisfied
     * @throws ObjectStoreException        if the read fails
     */
    GetResult getOpts(ObjectPath location, GetOptions options) throws ObjectStoreException;

    /**
     * Reads bytes {@code [start, end)} of the object at {@code location}.
     *
     * @param location the path to read
     * @param start    first byte, inclusive
     * @param end      last byte, exclusive; clipped to the object size
     * @return the bytes in range
     * @throws ObjectStoreException if the read fails
     */
    default byte[] getRange(ObjectPath location, long start, long end) throws ObjectStoreException {
        return getOpts(location, GetOptions.defaults().withRange(GetRange.bounded(start, end))).payload();
    }

    /**
     * Returns the metadata of the object at {@code location}.
     *
     * @param location the path to inspect
     * @return the metadata
     * @throws NotFoundException    if there is no object at {@code location}
     * @throws ObjectStoreException if the lookup fails
     */
    default ObjectMeta head(ObjectPath location) throws ObjectStoreException {
        return getOpts(location, GetOptions.defaults().asHead()).meta();
    }

    /**
     * Deletes the object at {@code location}.
     * <p>
     * Whether deleting a missing object fails with {@link NotFoundException} is
     * backend-specific.
     *
     * @param location the path to delete
     * @throws ObjectStoreException if the delete fails
     */
    void delete(ObjectPath location) throws ObjectStoreException;

    /**
     * Lists all objects below {@code prefix}, recursively.
     * <p>
     * The prefix matches whole path parts: prefix {@code "a/b"} lists {@code "a/b/c"} but
     * not {@code "a/bc"}. The order of results is backend-specific. Failures that occur
     * while the stream is consumed surface as {@link java.io.UncheckedIOException}.
     *
     * @param prefix the prefix to list, or {@code null} for the whole store
     * @return a lazy stream of metadata; must be closed by the caller
     */
    Stream<ObjectMeta> list(ObjectPath prefix);

    /**
     * Lists all objects below {@code prefix} whose location sorts after {@code offset}.
     *
     * @param prefix the prefix to list, or {@code null} for the whole store
     * @param offset exclusive lower bound on the location
     * @return a lazy stream of metadata; must be closed by the caller
     */
    default Stream<ObjectMeta> listWithOffset(ObjectPath prefix, ObjectPath offset) {
        return list(prefix).filter(meta -> meta.location().compareTo(offset) > 0);
    }

    /**
     * Lists the immediate children of {@code prefix}.
     *
     * @param prefix the prefix to list, or {@code null} for the root
     * @return objects and common prefixes directly below {@code prefix}
     * @throws ObjectStoreException if the listing fails
     */
    ListResult listWithDelimiter(ObjectPath prefix) throws ObjectStoreException;

    /**
     * Copies {@code from} to {@code to}, replacing any existing object at {@code to}.
     *
     * @param from the source path
     * @param to   the destination path
     * @throws NotFoundException    if there is no object at {@code from}
     * @throws ObjectStoreException if the copy fails
     */
    void copy(ObjectPath from, ObjectPath to) throws ObjectStoreException;

    /**
     * Copies {@code from} to {@code to} only if {@code to} does not exist.
     *
     * @param from the source path
     * @param to   the destination path
     * @throws AlreadyExistsException if an object exists at {@code to}
     * @throws ObjectStoreException   if the copy fails
     */
    void copyIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException;

    /**
     * Moves {@code from} to {@code to}, replacing any existing object at {@code to}.
     *
     * @param from the source path
     * @param to   the destination path
     * @throws ObjectStoreException if the move fails
     */
    default void rename(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        copy(from, to);
        delete(from);
    }

    /**
     * Moves {@code from} to {@code to} only if {@code to} does not exist.
     *
     * @param from the source path
     * @param to   the destination path
     * @throws AlreadyExistsException if an object exists at {@code to}
     * @throws ObjectStoreException   if the move fails
     */
    default void renameIfNotExists(ObjectPath from, ObjectPath to) throws ObjectStoreException {
        copyIfNotExists(from, to);
        delete(from);
    }
}
