package org.deltaio.storage.api;

/**
 * A resolved, half-open byte range {@code [start, end)}.
 *
 * @param start The first byte, inclusive.
 * @param end   The last byte, exclusive.
 */
public record ByteRange(long start, long end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(String.format("Invalid byte range [%d, %d)", start, end));
        }
    }

    public long length() {
        return end - start;
    }
}
