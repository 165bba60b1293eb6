package org.deltaio.storage.api;

/**
 * The target of a create-only write or copy already exists.
 */
public class AlreadyExistsException extends ObjectStoreException {

    public AlreadyExistsException(String message) {
        super(message);
    }

    public AlreadyExistsException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
