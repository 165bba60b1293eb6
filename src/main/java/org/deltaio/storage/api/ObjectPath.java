package org.deltaio.storage.api;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable, normalized key into an object store namespace.
 * <p>
 * A path is a sequence of non-empty parts joined by {@link #DELIMITER}. Leading and
 * trailing delimiters carry no meaning, so {@code "/a/b/"} and {@code "a/b"} denote the
 * same path. The root path has no parts and renders as the empty string; parsing
 * {@code "/"} yields the root.
 * <p>
 * <strong>Example paths:</strong>
 * <ul>
 *   <li>{@code "_delta_log/00000000000000000001.json"}</li>
 *   <li>{@code "part-00000.parquet"}</li>
 *   <li>{@code ""} (root)</li>
 * </ul>
 * <p>
 * <strong>Thread Safety:</strong> This class is immutable and thread-safe.
 */
public final class ObjectPath implements Comparable<ObjectPath> {

    /**
     * The separator between path parts.
     */
    public static final String DELIMITER = "/";

    private static final ObjectPath ROOT = new ObjectPath("");

    private final String raw;

    private ObjectPath(String raw) {
        this.raw = raw;
    }

    /**
     * Returns the root path.
     *
     * @return the path with no parts
     */
    public static ObjectPath root() {
        return ROOT;
    }

    /**
     * Parses a path strictly.
     * <p>
     * A single leading and trailing delimiter are stripped. Empty parts (as in
     * {@code "a//b"}) and the relative parts {@code "."} and {@code ".."} are rejected.
     *
     * @param path the path to parse
     * @return the parsed path
     * @throws IllegalArgumentException if the path contains an illegal part
     */
    public static ObjectPath parse(String path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        String stripped = path;
        if (stripped.startsWith(DELIMITER)) {
            stripped = stripped.substring(1);
        }
        if (stripped.endsWith(DELIMITER)) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        if (stripped.isEmpty()) {
            return ROOT;
        }
        for (String part : stripped.split(DELIMITER, -1)) {
            validatePart(part, path);
        }
        return new ObjectPath(stripped);
    }

    /**
     * Builds a path leniently by splitting on the delimiter and dropping empty parts.
     *
     * @param path the raw path
     * @return the normalized path
     * @throws IllegalArgumentException if a part is {@code "."} or {@code ".."}
     */
    public static ObjectPath from(String path) {
        if (path == null || path.isEmpty()) {
            return ROOT;
        }
        List<String> parts = new ArrayList<>();
        for (String part : path.split(DELIMITER)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return fromParts(parts);
    }

    /**
     * Builds a path from the percent-encoded path component of a URL.
     *
     * @param urlPath the path component, e.g. {@code "/data/my%20table"}
     * @return the decoded path
     * @throws IllegalArgumentException if the decoded path is not valid
     */
    public static ObjectPath fromUrlPath(String urlPath) {
        if (urlPath == null || urlPath.isEmpty()) {
            return ROOT;
        }
        String decoded = URLDecoder.decode(urlPath.replace("+", "%2B"), StandardCharsets.UTF_8);
        return parse(decoded);
    }

    /**
     * Builds a path from its parts.
     *
     * @param parts the parts, none of which may be empty or contain the delimiter
     * @return the path
     */
    public static ObjectPath fromParts(List<String> parts) {
        if (parts.isEmpty()) {
            return ROOT;
        }
        for (String part : parts) {
            validatePart(part, String.join(DELIMITER, parts));
            if (part.contains(DELIMITER)) {
                throw new IllegalArgumentException("Path part '" + part + "' contains the delimiter");
            }
        }
        return new ObjectPath(String.join(DELIMITER, parts));
    }

    /**
     * Returns a path with {@code name} appended as a single part.
     *
     * @param name the part to append
     * @return the child path
     */
    public ObjectPath child(String name) {
        validatePart(name, name);
        if (name.contains(DELIMITER)) {
            throw new IllegalArgumentException("Child name '" + name + "' contains the delimiter");
        }
        return isRoot() ? new ObjectPath(name) : new ObjectPath(raw + DELIMITER + name);
    }

    /**
     * Returns a path with all parts of {@code other} appended.
     *
     * @param other the path to append
     * @return the joined path
     */
    public ObjectPath join(ObjectPath other) {
        if (other.isRoot()) {
            return this;
        }
        if (isRoot()) {
            return other;
        }
        return new ObjectPath(raw + DELIMITER + other.raw);
    }

    /**
     * Returns the parts of this path.
     *
     * @return the parts, empty for the root
     */
    public List<String> parts() {
        if (isRoot()) {
            return Collections.emptyList();
        }
        return List.of(raw.split(DELIMITER));
    }

    /**
     * Returns the last part of this path.
     *
     * @return the file name, empty for the root
     */
    public Optional<String> filename() {
        if (isRoot()) {
            return Optional.empty();
        }
        return Optional.of(raw.substring(raw.lastIndexOf(DELIMITER) + 1));
    }

    /**
     * Matches this path against {@code prefix} part by part.
     * <p>
     * {@code "a/b/c"} has prefix {@code "a/b"} but {@code "a/bc"} does not.
     *
     * @param prefix the prefix to strip
     * @return the remaining path when {@code prefix} matches, empty otherwise
     */
    public Optional<ObjectPath> stripPrefix(ObjectPath prefix) {
        if (prefix.isRoot()) {
            return Optional.of(this);
        }
        if (raw.equals(prefix.raw)) {
            return Optional.of(ROOT);
        }
        if (raw.startsWith(prefix.raw + DELIMITER)) {
            return Optional.of(new ObjectPath(raw.substring(prefix.raw.length() + 1)));
        }
        return Optional.empty();
    }

    /**
     * Returns whether this path lies strictly below {@code prefix}.
     *
     * @param prefix the candidate ancestor
     * @return {@code true} if at least one part remains after stripping {@code prefix}
     */
    public boolean isStrictlyUnder(ObjectPath prefix) {
        return stripPrefix(prefix).map(rest -> !rest.isRoot()).orElse(false);
    }

    /**
     * Returns whether this is the root path.
     *
     * @return {@code true} for the root
     */
    public boolean isRoot() {
        return raw.isEmpty();
    }

    /**
     * Returns the path as a string.
     *
     * @return the delimiter-joined parts
     */
    public String asString() {
        return raw;
    }

    private static void validatePart(String part, String path) {
        if (part.isEmpty()) {
            throw new IllegalArgumentException("Path '" + path + "' contains an empty part");
        }
        if (part.equals(".") || part.equals("..")) {
            throw new IllegalArgumentException("Path '" + path + "' contains illegal relative part '" + part + "'");
        }
        for (char c : part.toCharArray()) {
            if (c < 0x20) {
                throw new IllegalArgumentException("Path '" + path + "' contains control character (0x"
                        + Integer.toHexString(c) + ")");
            }
        }
    }

    @Override
    public int compareTo(ObjectPath other) {
        return raw.compareTo(other.raw);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ObjectPath that = (ObjectPath) o;
        return raw.equals(that.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
