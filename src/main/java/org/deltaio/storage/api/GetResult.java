package org.deltaio.storage.api;

/**
 * The outcome of a read.
 * <p>
 * The payload array is owned by the caller; stores hand out a fresh copy per read.
 *
 * @param meta    The metadata of the object that was read.
 * @param range   The byte range of the object contained in {@code payload}.
 * @param payload The bytes read, empty for head requests.
 */
public record GetResult(ObjectMeta meta, ByteRange range, byte[] payload) {

    /**
     * Returns a copy of this result reported under another location.
     *
     * @param location the location to report
     * @return the relocated result
     */
    public GetResult withLocation(ObjectPath location) {
        return new GetResult(meta.withLocation(location), range, payload);
    }
}
