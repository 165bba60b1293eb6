package org.deltaio.storage.api;

import java.time.Instant;

/**
 * Metadata of a single stored object.
 *
 * @param location     The path of the object, relative to the store that reported it.
 * @param lastModified The last modification time.
 * @param size         The size in bytes.
 * @param eTag         The entity tag, or {@code null} if the store does not provide one.
 * @param version      The object version, or {@code null} if the store is not versioned.
 */
public record ObjectMeta(
        ObjectPath location,
        Instant lastModified,
        long size,
        String eTag,
        String version
) {

    /**
     * Returns a copy of this metadata reported under another location.
     *
     * @param newLocation the location to report
     * @return the relocated metadata
     */
    public ObjectMeta withLocation(ObjectPath newLocation) {
        return new ObjectMeta(newLocation, lastModified, size, eTag, version);
    }
}
