package org.deltaio.storage.api;

import java.util.List;

/**
 * Result of a delimiter listing: the immediate children of a prefix.
 *
 * @param commonPrefixes The "directories" directly below the listed prefix.
 * @param objects        The objects directly below the listed prefix.
 */
public record ListResult(
        List<ObjectPath> commonPrefixes,
        List<ObjectMeta> objects
) {

    public ListResult {
        commonPrefixes = List.copyOf(commonPrefixes);
        objects = List.copyOf(objects);
    }
}
