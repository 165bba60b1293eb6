package org.deltaio.storage.api;

/**
 * No object found at the requested location.
 */
public class NotFoundException extends ObjectStoreException {

    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
