package org.deltaio.storage.api;

import java.util.Map;

/**
 * Options for starting a multipart upload.
 *
 * @param attributes Opaque key/value attributes passed to the backend; backends that
 *                   do not support attributes ignore them.
 */
public record PutMultipartOptions(Map<String, String> attributes) {

    private static final PutMultipartOptions DEFAULTS = new PutMultipartOptions(Map.of());

    public PutMultipartOptions {
        attributes = Map.copyOf(attributes);
    }

    /**
     * Returns options without attributes.
     *
     * @return the default options
     */
    public static PutMultipartOptions defaults() {
        return DEFAULTS;
    }
}
