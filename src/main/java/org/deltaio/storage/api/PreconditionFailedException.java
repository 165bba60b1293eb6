package org.deltaio.storage.api;

/**
 * A conditional request found the object in an unexpected state (e.g. an eTag mismatch).
 */
public class PreconditionFailedException extends ObjectStoreException {

    public PreconditionFailedException(String message) {
        super(message);
    }

    public PreconditionFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
