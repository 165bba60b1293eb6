package org.deltaio.storage.api;

/**
 * The backend does not implement the requested operation or mode.
 */
public class NotSupportedException extends ObjectStoreException {

    public NotSupportedException(String message) {
        super(message);
    }

    public NotSupportedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
