package org.deltaio.storage.api;

/**
 * Conflict behaviour of a write.
 *
 * @param kind            The write mode.
 * @param expectedETag    For {@link Kind#UPDATE}, the entity tag the current object must carry.
 * @param expectedVersion For {@link Kind#UPDATE}, the version the current object must carry, or {@code null}.
 */
public record PutMode(Kind kind, String expectedETag, String expectedVersion) {

    /**
     * The available write modes.
     */
    public enum Kind {
        /**
         * Replace any existing object.
         */
        OVERWRITE,
        /**
         * Fail with {@link AlreadyExistsException} if the object exists.
         */
        CREATE,
        /**
         * Replace the object only if it still matches the expected entity tag.
         */
        UPDATE
    }

    public static final PutMode OVERWRITE = new PutMode(Kind.OVERWRITE, null, null);
    public static final PutMode CREATE = new PutMode(Kind.CREATE, null, null);

    public PutMode {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (kind == Kind.UPDATE && expectedETag == null) {
            throw new IllegalArgumentException("UPDATE requires an expected eTag");
        }
    }

    /**
     * Creates a conditional update mode.
     *
     * @param eTag    the entity tag the current object must carry
     * @param version the version the current object must carry, or {@code null}
     * @return the update mode
     */
    public static PutMode update(String eTag, String version) {
        return new PutMode(Kind.UPDATE, eTag, version);
    }
}
