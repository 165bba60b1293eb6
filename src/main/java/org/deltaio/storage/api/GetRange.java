package org.deltaio.storage.api;

import java.util.Objects;

/**
 * A requested byte range, resolved against the object size at read time.
 * <ul>
 *   <li>{@link #bounded(long, long)}: bytes {@code [start, end)}, clipped to the object size</li>
 *   <li>{@link #offset(long)}: everything from {@code start}</li>
 *   <li>{@link #suffix(long)}: the last {@code length} bytes</li>
 * </ul>
 */
public final class GetRange {

    private enum Kind { BOUNDED, OFFSET, SUFFIX }

    private final Kind kind;
    private final long first;
    private final long second;

    private GetRange(Kind kind, long first, long second) {
        this.kind = kind;
        this.first = first;
        this.second = second;
    }

    public static GetRange bounded(long start, long end) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException(String.format("Range [%d, %d) is empty or negative", start, end));
        }
        return new GetRange(Kind.BOUNDED, start, end);
    }

    public static GetRange offset(long start) {
        if (start < 0) {
            throw new IllegalArgumentException("Offset cannot be negative: " + start);
        }
        return new GetRange(Kind.OFFSET, start, -1);
    }

    public static GetRange suffix(long length) {
        if (length < 0) {
            throw new IllegalArgumentException("Suffix length cannot be negative: " + length);
        }
        return new GetRange(Kind.SUFFIX, length, -1);
    }

    /**
     * Resolves this range against an object of {@code size} bytes.
     *
     * @param size the object size
     * @return the concrete range
     * @throws InvalidRangeException if the range starts beyond the end of the object
     */
    public ByteRange resolve(long size) throws InvalidRangeException {
        switch (kind) {
            case BOUNDED:
                if (first >= size) {
                    throw new InvalidRangeException(String.format(
                            "Range started at %d beyond object size %d", first, size));
                }
                return new ByteRange(first, Math.min(second, size));
            case OFFSET:
                if (first >= size) {
                    throw new InvalidRangeException(String.format(
                            "Offset %d beyond object size %d", first, size));
                }
                return new ByteRange(first, size);
            case SUFFIX:
                return new ByteRange(Math.max(0, size - first), size);
            default:
                throw new IllegalStateException("Unknown range kind: " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GetRange that = (GetRange) o;
        return first == that.first && second == that.second && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, first, second);
    }

    @Override
    public String toString() {
        switch (kind) {
            case BOUNDED:
                return "bytes=" + first + "-" + (second - 1);
            case OFFSET:
                return "bytes=" + first + "-";
            default:
                return "bytes=-" + first;
        }
    }
}
