package org.deltaio.storage.api;

/**
 * A stateful multipart upload session.
 * <p>
 * Parts are appended in call order. The object becomes visible only after
 * {@link #complete()}; {@link #abort()} discards everything uploaded so far. A session
 * must not be used after it was completed or aborted.
 */
public interface MultipartUpload {

    /**
     * Uploads the next part.
     *
     * @param data the part contents
     * @throws ObjectStoreException if the part cannot be stored
     */
    void putPart(byte[] data) throws ObjectStoreException;

    /**
     * Assembles all uploaded parts into the target object.
     *
     * @return the result of the final write
     * @throws ObjectStoreException if the object cannot be assembled
     */
    PutResult complete() throws ObjectStoreException;

    /**
     * Discards all uploaded parts.
     *
     * @throws ObjectStoreException if staged data cannot be removed
     */
    void abort() throws ObjectStoreException;
}
