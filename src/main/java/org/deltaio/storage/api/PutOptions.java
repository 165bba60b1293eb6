package org.deltaio.storage.api;

import java.util.Map;

/**
 * Options for a single-request write.
 *
 * @param mode       The conflict behaviour.
 * @param attributes Opaque key/value attributes; backends that do not support them ignore them.
 */
public record PutOptions(PutMode mode, Map<String, String> attributes) {

    private static final PutOptions DEFAULTS = new PutOptions(PutMode.OVERWRITE, Map.of());

    public PutOptions {
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        attributes = Map.copyOf(attributes);
    }

    public static PutOptions defaults() {
        return DEFAULTS;
    }

    public static PutOptions of(PutMode mode) {
        return new PutOptions(mode, Map.of());
    }
}
