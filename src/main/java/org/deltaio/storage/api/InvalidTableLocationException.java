package org.deltaio.storage.api;

import java.net.URI;

/**
 * Thrown when a URL cannot be mapped to a store: the scheme has no registered factory,
 * the URL is malformed, or its path cannot be mapped into the backend's namespace.
 */
public class InvalidTableLocationException extends DeltaStorageException {

    private final String location;

    public InvalidTableLocationException(URI location) {
        this(location, "Invalid table location: " + location, null);
    }

    public InvalidTableLocationException(URI location, String message, Throwable cause) {
        super(message, cause);
        this.location = String.valueOf(location);
    }

    /**
     * Returns the offending location as given by the caller.
     *
     * @return the location string
     */
    public String getLocation() {
        return location;
    }
}
