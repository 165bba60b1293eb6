package org.deltaio.storage.api;

/**
 * A requested byte range cannot be satisfied by the object.
 */
public class InvalidRangeException extends ObjectStoreException {

    public InvalidRangeException(String message) {
        super(message);
    }

    public InvalidRangeException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
