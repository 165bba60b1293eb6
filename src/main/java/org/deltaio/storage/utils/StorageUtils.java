package org.deltaio.storage.utils;

import org.deltaio.storage.api.ObjectPath;

import java.util.Locale;
import java.util.Set;

/**
 * Naming and option helpers shared by the storage layer and its callers.
 */
public final class StorageUtils {

    /** Directory holding the transaction log of a table. */
    public static final ObjectPath DELTA_LOG_PATH = ObjectPath.parse("_delta_log");

    private static final Set<String> TRUTHY = Set.of("1", "true", "on", "yes", "y");

    private StorageUtils() {
    }

    /**
     * Returns the path of the commit file for {@code version}.
     * <p>
     * Example: version 1 maps to {@code _delta_log/00000000000000000001.json}.
     *
     * @param version the non-negative table version
     * @return the commit file path
     */
    public static ObjectPath commitUriFromVersion(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative, got " + version);
        }
        return DELTA_LOG_PATH.child(String.format("%020d.json", version));
    }

    /**
     * Returns whether {@code value} is one of {@code 1}, {@code true}, {@code on},
     * {@code yes} or {@code y}, ignoring case.
     */
    public static boolean strIsTruthy(String value) {
        return value != null && TRUTHY.contains(value.toLowerCase(Locale.ROOT));
    }
}
